package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * HTTP 5xx.
 */
public class ServerException extends SonarQubeException {

	private final @Nullable String requestId;

	public ServerException(String message, int statusCode, @Nullable String requestId, @Nullable String responseBody,
			Map<String, List<String>> headers) {
		super(ErrorKind.SERVER, message, statusCode, responseBody, headers, null);
		this.requestId = requestId;
	}

	/**
	 * Correlation id the server attached to the response, for support requests.
	 * @return the request id, or null if none was sent
	 */
	@Nullable
	public String getRequestId() {
		return requestId;
	}

}
