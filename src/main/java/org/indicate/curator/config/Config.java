package org.indicate.curator.config;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.PropertySource;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@SpringBootApplication(
		scanBasePackages = "org.indicate.curator",
		exclude = {
				// Vocabulary databases are opened on request, there is no application DataSource
				DataSourceAutoConfiguration.class,
				DataSourceTransactionManagerAutoConfiguration.class
		}
)
@EnableConfigurationProperties
@PropertySource(value = "classpath:application.properties", encoding = "UTF-8")
public abstract class Config {

	@Bean
	@ConfigurationProperties(prefix = "vocabulary")
	public VocabularyProperties vocabularyProperties() {
		return new VocabularyProperties();
	}

	@Bean(destroyMethod = "shutdown")
	public ExecutorService taskExecutor(VocabularyProperties vocabularyProperties) {
		return Executors.newFixedThreadPool(Math.max(1, vocabularyProperties.getLoadThreads()));
	}

}
