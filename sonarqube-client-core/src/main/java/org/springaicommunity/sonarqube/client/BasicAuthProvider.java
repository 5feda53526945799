package org.springaicommunity.sonarqube.client;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Login and password sent as {@code Authorization: Basic}. SonarQube also accepts a token
 * as the login with an empty password.
 */
public final class BasicAuthProvider implements AuthProvider {

	private final String username;

	private final String encoded;

	public BasicAuthProvider(String username, String password) {
		if (username == null || username.isBlank()) {
			throw new IllegalArgumentException("Username must not be blank");
		}
		if (password == null) {
			throw new IllegalArgumentException("Password must not be null");
		}
		this.username = username;
		this.encoded = Base64.getEncoder()
			.encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public HttpRequest.Builder applyAuth(HttpRequest.Builder request) {
		return request.header("Authorization", "Basic " + encoded);
	}

	@Override
	public AuthType getAuthType() {
		return AuthType.BASIC;
	}

	public String getUsername() {
		return username;
	}

	@Override
	public String toString() {
		return "BasicAuthProvider[username=" + username + "]";
	}

}
