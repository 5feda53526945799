package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Failure with a status that no more specific kind covers, or a successful response whose
 * body could not be read.
 */
public class ApiException extends SonarQubeException {

	public ApiException(String message, int statusCode, @Nullable String responseBody,
			Map<String, List<String>> headers) {
		super(ErrorKind.API, message, statusCode, responseBody, headers, null);
	}

	public ApiException(String message, int statusCode, @Nullable String responseBody, Throwable cause) {
		super(ErrorKind.API, message, statusCode, responseBody, Map.of(), cause);
	}

}
