package org.indicate.curator.rest;

import org.apache.commons.lang3.StringUtils;
import org.indicate.curator.core.data.services.NotFoundException;

public class ControllerHelper {

	public static final String IS_A_REQUIRED_PARAMETER = " is a required parameter.";

	static String requiredParam(String value, String paramName) {
		if (StringUtils.isBlank(value)) {
			throw new IllegalArgumentException(paramName + IS_A_REQUIRED_PARAMETER);
		}
		return value;
	}

	static <T> T requiredParam(T value, String paramName) {
		if (value == null) {
			throw new IllegalArgumentException(paramName + IS_A_REQUIRED_PARAMETER);
		}
		return value;
	}

	public static <T> T throwIfNotFound(String type, T component) {
		if (component == null) {
			throw new NotFoundException(type + " not found");
		}
		return component;
	}

}
