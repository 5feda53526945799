package org.springaicommunity.sonarqube.client;

import java.util.Map;

/**
 * The request did not complete within the configured timeout.
 */
public class RequestTimeoutException extends SonarQubeException {

	public RequestTimeoutException(String message, Throwable cause) {
		super(ErrorKind.TIMEOUT, message, null, null, Map.of(), cause);
	}

}
