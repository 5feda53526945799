package org.springaicommunity.sonarqube.client;

import java.net.http.HttpRequest;

/**
 * User token sent as {@code Authorization: Bearer <token>}.
 */
public final class BearerTokenAuthProvider implements AuthProvider {

	private final String token;

	public BearerTokenAuthProvider(String token) {
		if (token == null || token.isBlank()) {
			throw new IllegalArgumentException("Token must not be blank");
		}
		this.token = token.trim();
	}

	@Override
	public HttpRequest.Builder applyAuth(HttpRequest.Builder request) {
		return request.header("Authorization", "Bearer " + token);
	}

	@Override
	public AuthType getAuthType() {
		return AuthType.BEARER;
	}

	@Override
	public String toString() {
		return "BearerTokenAuthProvider[token=****]";
	}

}
