package org.indicate.curator.core.data.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StandardFlag {

	STANDARD("S", "Standard"),
	CLASSIFICATION("C", "Classification"),
	NON_STANDARD(null, "Non-standard");

	private final String code;
	private final String label;

	StandardFlag(String code, String label) {
		this.code = code;
		this.label = label;
	}

	public static StandardFlag fromCode(String code) {
		if (STANDARD.code.equals(code)) {
			return STANDARD;
		} else if (CLASSIFICATION.code.equals(code)) {
			return CLASSIFICATION;
		}
		return NON_STANDARD;
	}

	public String getCode() {
		return code;
	}

	@JsonValue
	public String getLabel() {
		return label;
	}
}
