package org.indicate.curator;

import org.apache.commons.lang3.StringUtils;
import org.indicate.curator.config.Config;
import org.indicate.curator.config.VocabularyProperties;
import org.indicate.curator.core.data.services.VocabularyService;
import org.indicate.curator.core.data.services.pojo.VocabularyLoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;

import java.util.List;

public class CuratorApplication extends Config implements ApplicationRunner {

	private static final String FOLDER_ARG = "vocabulary-folder";
	private static final String JDBC_URL_ARG = "vocabulary-jdbc-url";

	@Autowired
	private VocabularyService vocabularyService;

	@Autowired
	private VocabularyProperties vocabularyProperties;

	private static final Logger logger = LoggerFactory.getLogger(CuratorApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(CuratorApplication.class, args);
	}

	@Override
	public void run(ApplicationArguments applicationArguments) {
		String folder = getOneValue(applicationArguments, FOLDER_ARG, vocabularyProperties.getFolder());
		String jdbcUrl = getOneValue(applicationArguments, JDBC_URL_ARG, vocabularyProperties.getJdbcUrl());

		VocabularyLoadResult result = null;
		if (StringUtils.isNotBlank(jdbcUrl)) {
			result = vocabularyService.openDatabase(jdbcUrl);
		} else if (StringUtils.isNotBlank(folder)) {
			result = vocabularyService.openFolder(folder);
		}

		if (result == null) {
			logger.info("No vocabulary configured, load one through the vocabulary endpoint.");
		} else if (!result.isSuccess()) {
			logger.warn("Vocabulary at {} could not be loaded at startup: {}", result.getLocation(), result.getMessage());
		}
		logger.info("--- Concept curator startup complete ---");
	}

	private String getOneValue(ApplicationArguments applicationArguments, String argName, String defaultValue) {
		List<String> values = applicationArguments.getOptionValues(argName);
		if (values == null || values.isEmpty()) {
			return defaultValue;
		}
		if (values.size() > 1) {
			throw new IllegalArgumentException("Only one value expected for argument '" + argName + "'.");
		}
		return values.get(0);
	}
}
