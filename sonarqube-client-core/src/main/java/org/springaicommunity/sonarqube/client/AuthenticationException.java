package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * HTTP 401: missing, expired or invalid credentials.
 */
public class AuthenticationException extends SonarQubeException {

	public AuthenticationException(String message, @Nullable String responseBody, Map<String, List<String>> headers) {
		super(ErrorKind.AUTHENTICATION, message, 401, responseBody, headers, null);
	}

}
