package org.springaicommunity.sonarqube.client;

import java.time.Duration;

/**
 * Configuration properties for the SonarQube client.
 *
 * <p>
 * Properties can be set directly via setters and passed to
 * {@link SonarQubeClientBuilder#properties(SonarQubeClientProperties)}. Default values
 * target a local SonarQube instance without retries.
 */
public class SonarQubeClientProperties {

	/**
	 * Default base URL of the SonarQube server.
	 */
	public static final String DEFAULT_BASE_URL = "http://localhost:9000";

	/**
	 * Default {@code User-Agent} header.
	 */
	public static final String DEFAULT_USER_AGENT = "sonarqube-client-java";

	/**
	 * Base URL of the SonarQube server, without the {@code /api} suffix.
	 */
	private String baseUrl = DEFAULT_BASE_URL;

	/**
	 * Timeout for establishing a connection.
	 */
	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * Timeout for a complete request, response body included.
	 */
	private Duration requestTimeout = Duration.ofSeconds(60);

	/**
	 * Maximum number of retries for transient failures. 0 disables retries.
	 */
	private int maxRetries = 0;

	/**
	 * Initial delay between retries, doubled on each attempt.
	 */
	private Duration retryDelay = Duration.ofSeconds(1);

	/**
	 * Longest {@code Retry-After} delay that is honoured for rate limited requests.
	 */
	private Duration maxRetryAfter = Duration.ofSeconds(300);

	/**
	 * Value of the {@code User-Agent} header.
	 */
	private String userAgent = DEFAULT_USER_AGENT;

	/**
	 * Reaction to deprecated parameters.
	 */
	private DeprecationPolicy deprecationPolicy = DeprecationPolicy.WARN;

	public String getBaseUrl() {
		return baseUrl;
	}

	public void setBaseUrl(String baseUrl) {
		this.baseUrl = baseUrl;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Returns the maximum number of retry attempts.
	 * @return the maximum retries, 0 when retries are disabled
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Sets the maximum number of retry attempts for transient failures.
	 * @param maxRetries the maximum retries
	 */
	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public Duration getRetryDelay() {
		return retryDelay;
	}

	public void setRetryDelay(Duration retryDelay) {
		this.retryDelay = retryDelay;
	}

	public Duration getMaxRetryAfter() {
		return maxRetryAfter;
	}

	public void setMaxRetryAfter(Duration maxRetryAfter) {
		this.maxRetryAfter = maxRetryAfter;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public DeprecationPolicy getDeprecationPolicy() {
		return deprecationPolicy;
	}

	public void setDeprecationPolicy(DeprecationPolicy deprecationPolicy) {
		this.deprecationPolicy = deprecationPolicy;
	}

	@Override
	public String toString() {
		return "SonarQubeClientProperties{" + "baseUrl='" + baseUrl + '\'' + ", connectTimeout=" + connectTimeout
				+ ", requestTimeout=" + requestTimeout + ", maxRetries=" + maxRetries + ", retryDelay=" + retryDelay
				+ ", maxRetryAfter=" + maxRetryAfter + ", userAgent='" + userAgent + '\'' + ", deprecationPolicy="
				+ deprecationPolicy + '}';
	}

}
