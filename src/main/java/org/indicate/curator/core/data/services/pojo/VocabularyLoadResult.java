package org.indicate.curator.core.data.services.pojo;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class VocabularyLoadResult {

	private final boolean success;
	private final String location;
	private final String message;

	private VocabularyLoadResult(boolean success, String location, String message) {
		this.success = success;
		this.location = location;
		this.message = message;
	}

	public static VocabularyLoadResult success(String location) {
		return new VocabularyLoadResult(true, location, "Vocabulary loaded.");
	}

	public static VocabularyLoadResult failure(String location, String message) {
		return new VocabularyLoadResult(false, location, message);
	}

	public boolean isSuccess() {
		return success;
	}

	public String getLocation() {
		return location;
	}

	public String getMessage() {
		return message;
	}
}
