package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * HTTP 429: too many requests.
 */
public class RateLimitException extends SonarQubeException {

	private final @Nullable Integer retryAfterSeconds;

	public RateLimitException(String message, @Nullable Integer retryAfterSeconds, @Nullable String responseBody,
			Map<String, List<String>> headers) {
		super(ErrorKind.RATE_LIMIT, message, 429, responseBody, headers, null);
		this.retryAfterSeconds = retryAfterSeconds;
	}

	/**
	 * Delay requested by the server through {@code Retry-After}.
	 * @return seconds to wait, or null if the header was absent or not a number
	 */
	@Nullable
	public Integer getRetryAfterSeconds() {
		return retryAfterSeconds;
	}

}
