package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Client for {@code api/authentication}.
 */
public class AuthenticationClient extends ResourceClient {

	public AuthenticationClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	/**
	 * Check the credentials the client was built with. The server answers {@code true} for
	 * anonymous requests as well, so a valid result does not imply a logged-in user.
	 * @return false if the credentials were rejected
	 */
	public boolean validate() {
		return getJson("/api/authentication/validate", QueryParameters.create(), ValidateResponse.class).valid();
	}

	/**
	 * End the session bound to the current credentials.
	 */
	public void logout() {
		post("/api/authentication/logout", QueryParameters.create());
	}

	record ValidateResponse(boolean valid) {
	}

}
