package org.springaicommunity.sonarqube.client;

/**
 * Discriminant of a {@link SonarQubeException}. Exactly one kind is assigned to every
 * failed call.
 */
public enum ErrorKind {

	VALIDATION("VALIDATION_ERROR"),

	AUTHENTICATION("AUTHENTICATION_ERROR"),

	AUTHORIZATION("AUTHORIZATION_ERROR"),

	NOT_FOUND("NOT_FOUND_ERROR"),

	REMOVED_API("API_REMOVED"),

	RATE_LIMIT("RATE_LIMIT_ERROR"),

	SERVER("SERVER_ERROR"),

	NETWORK("NETWORK_ERROR"),

	TIMEOUT("TIMEOUT_ERROR"),

	API("API_ERROR");

	private final String code;

	ErrorKind(String code) {
		this.code = code;
	}

	/**
	 * Stable error code, suitable for logs and metrics tags.
	 * @return the code
	 */
	public String code() {
		return code;
	}

}
