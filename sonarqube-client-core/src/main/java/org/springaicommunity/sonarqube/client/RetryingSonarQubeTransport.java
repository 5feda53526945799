package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Decorator that retries transient failures of a {@link SonarQubeTransport}.
 *
 * <p>
 * Retried:
 * <ul>
 * <li>{@link ServerException} (5xx), except {@link IndexingInProgressException} unless
 * {@link Builder#retryIndexing(boolean)} is enabled</li>
 * <li>{@link NetworkException} and {@link RequestTimeoutException}</li>
 * <li>{@link RateLimitException} (429), waiting for {@code Retry-After} when the server
 * sends one and it does not exceed {@link Builder#maxRetryAfter(Duration)}</li>
 * </ul>
 * Every other failure is rethrown immediately. POST requests are never retried since
 * SonarQube write endpoints are not idempotent.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * SonarQubeTransport transport = RetryingSonarQubeTransport.builder()
 *     .wrapping(new HttpSonarQubeTransport(url, new BearerTokenAuthProvider(token)))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingSonarQubeTransport implements SonarQubeTransport {

	private static final Logger logger = LoggerFactory.getLogger(RetryingSonarQubeTransport.class);

	private final SonarQubeTransport delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final long maxRetryAfterMs;

	private final boolean retryIndexing;

	private RetryingSonarQubeTransport(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.maxRetryAfterMs = builder.maxRetryAfterMs;
		this.retryIndexing = builder.retryIndexing;
	}

	/**
	 * Create a new builder for RetryingSonarQubeTransport.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path, QueryParameters query) {
		return executeWithRetry(() -> delegate.get(path, query), "GET " + path);
	}

	@Override
	public byte[] getBytes(String path, QueryParameters query) {
		return executeWithRetry(() -> delegate.getBytes(path, query), "GET " + path);
	}

	@Override
	public String post(String path, QueryParameters form) {
		return delegate.post(path, form);
	}

	private <T> T executeWithRetry(Supplier<T> request, String description) {
		long delay = initialDelayMs;
		for (int attempt = 0;; attempt++) {
			try {
				return request.get();
			}
			catch (SonarQubeException e) {
				if (!isRetryable(e)) {
					throw e;
				}
				if (attempt >= maxRetries) {
					logger.error("{} failed after {} attempts", description, attempt + 1);
					throw e;
				}
				long waitMs = computeWaitTime(e, delay);
				logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt + 1,
						maxRetries + 1, e.getMessage(), waitMs);
				sleep(waitMs);
				delay *= 2;
			}
		}
	}

	boolean isRetryable(SonarQubeException e) {
		if (e instanceof IndexingInProgressException) {
			return retryIndexing;
		}
		return e instanceof ServerException || e instanceof NetworkException || e instanceof RequestTimeoutException
				|| e instanceof RateLimitException;
	}

	/**
	 * Honour {@code Retry-After} for rate limited requests when it is within the
	 * configured cap, otherwise fall back to the exponential delay.
	 */
	long computeWaitTime(SonarQubeException e, long defaultDelay) {
		if (e instanceof RateLimitException) {
			Integer retryAfter = ((RateLimitException) e).getRetryAfterSeconds();
			if (retryAfter != null) {
				long waitMs = retryAfter * 1000L;
				if (waitMs <= maxRetryAfterMs) {
					logger.info("Rate limited. Waiting {} seconds as requested by the server", retryAfter);
					return waitMs;
				}
				logger.warn("Retry-After of {} seconds exceeds the configured maximum, using exponential backoff",
						retryAfter);
			}
		}
		return defaultDelay;
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new NetworkException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingSonarQubeTransport}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxRetries: 3</li>
	 * <li>initialDelay: 1 second</li>
	 * <li>maxRetryAfter: 300 seconds</li>
	 * <li>retryIndexing: false</li>
	 * </ul>
	 */
	public static class Builder {

		private @Nullable SonarQubeTransport delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private long maxRetryAfterMs = 300_000;

		private boolean retryIndexing;

		private Builder() {
		}

		/**
		 * Set the transport to wrap with retry logic.
		 * @param transport the transport to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(SonarQubeTransport transport) {
			this.delegate = transport;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Set the longest {@code Retry-After} that is honoured. Longer requests fall back
		 * to exponential backoff.
		 * @param maxRetryAfter cap (default: 300 seconds)
		 * @return this builder
		 */
		public Builder maxRetryAfter(Duration maxRetryAfter) {
			this.maxRetryAfterMs = maxRetryAfter.toMillis();
			return this;
		}

		/**
		 * Whether to retry 503 responses caused by issue indexing.
		 * @param retryIndexing true to retry (default: false)
		 * @return this builder
		 */
		public Builder retryIndexing(boolean retryIndexing) {
			this.retryIndexing = retryIndexing;
			return this;
		}

		/**
		 * Build the RetryingSonarQubeTransport.
		 * @return configured RetryingSonarQubeTransport
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingSonarQubeTransport build() {
			if (delegate == null) {
				throw new IllegalStateException("A SonarQubeTransport to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			if (maxRetryAfterMs < 0) {
				throw new IllegalStateException("maxRetryAfter must be non-negative");
			}
			return new RetryingSonarQubeTransport(this);
		}

	}

}
