package org.indicate.curator;

import org.indicate.curator.core.data.services.VocabularyService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.junit.jupiter.SpringExtension;

@ExtendWith(SpringExtension.class)
@ContextConfiguration(classes = TestConfig.class)
public abstract class AbstractTest {

	@Autowired
	protected VocabularyService vocabularyService;

	protected void install(TestVocabulary vocabulary) {
		vocabularyService.install(vocabulary.build());
	}

	@AfterEach
	void clearVocabulary() {
		vocabularyService.clear();
	}

}
