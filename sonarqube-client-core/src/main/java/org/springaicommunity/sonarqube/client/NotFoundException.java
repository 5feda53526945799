package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * HTTP 404.
 */
public class NotFoundException extends SonarQubeException {

	public NotFoundException(String message, @Nullable String responseBody, Map<String, List<String>> headers) {
		super(ErrorKind.NOT_FOUND, message, 404, responseBody, headers, null);
	}

}
