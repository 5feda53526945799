package org.springaicommunity.sonarqube.client;

import java.util.Map;

/**
 * No HTTP response was obtained: DNS failure, refused connection, reset socket or an
 * interrupted call.
 */
public class NetworkException extends SonarQubeException {

	public NetworkException(String message, Throwable cause) {
		super(ErrorKind.NETWORK, message, null, null, Map.of(), cause);
	}

}
