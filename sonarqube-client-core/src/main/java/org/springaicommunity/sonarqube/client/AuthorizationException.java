package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * HTTP 403: authenticated, but lacking the permission the endpoint requires.
 */
public class AuthorizationException extends SonarQubeException {

	public AuthorizationException(String message, @Nullable String responseBody, Map<String, List<String>> headers) {
		super(ErrorKind.AUTHORIZATION, message, 403, responseBody, headers, null);
	}

}
