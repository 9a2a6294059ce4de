package org.indicate.curator.core.data.store;

import org.indicate.curator.core.data.services.ServiceException;

public class VocabularyLoadException extends ServiceException {
	public VocabularyLoadException(String message) {
		super(message);
	}

	public VocabularyLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
