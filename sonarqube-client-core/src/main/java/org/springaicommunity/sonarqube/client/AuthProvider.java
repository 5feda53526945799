package org.springaicommunity.sonarqube.client;

import java.net.http.HttpRequest;

/**
 * Strategy for attaching credentials to outgoing requests.
 */
public interface AuthProvider {

	/**
	 * Add the credentials of this provider to a request.
	 * @param request request under construction
	 * @return the same builder
	 */
	HttpRequest.Builder applyAuth(HttpRequest.Builder request);

	AuthType getAuthType();

	/**
	 * Supported authentication schemes.
	 */
	enum AuthType {

		BEARER, BASIC, PASSCODE, NONE

	}

}
