package org.springaicommunity.sonarqube.client;

import java.net.http.HttpRequest;

/**
 * System passcode sent as {@code X-Sonar-Passcode}, accepted by monitoring endpoints such
 * as {@code api/system/health}.
 */
public final class PasscodeAuthProvider implements AuthProvider {

	static final String HEADER = "X-Sonar-Passcode";

	private final String passcode;

	public PasscodeAuthProvider(String passcode) {
		if (passcode == null || passcode.isBlank()) {
			throw new IllegalArgumentException("Passcode must not be blank");
		}
		this.passcode = passcode;
	}

	@Override
	public HttpRequest.Builder applyAuth(HttpRequest.Builder request) {
		return request.header(HEADER, passcode);
	}

	@Override
	public AuthType getAuthType() {
		return AuthType.PASSCODE;
	}

}
