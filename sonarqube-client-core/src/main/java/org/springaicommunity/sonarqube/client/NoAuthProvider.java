package org.springaicommunity.sonarqube.client;

import java.net.http.HttpRequest;

/**
 * Anonymous access.
 */
public final class NoAuthProvider implements AuthProvider {

	public static final NoAuthProvider INSTANCE = new NoAuthProvider();

	private NoAuthProvider() {
	}

	@Override
	public HttpRequest.Builder applyAuth(HttpRequest.Builder request) {
		return request;
	}

	@Override
	public AuthType getAuthType() {
		return AuthType.NONE;
	}

}
