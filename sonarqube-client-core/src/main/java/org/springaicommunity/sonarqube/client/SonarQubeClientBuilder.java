package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builder for {@link SonarQubeClient}, usable without Spring.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Base URL and token from SONAR_HOST_URL and SONAR_TOKEN
 * SonarQubeClient client = SonarQubeClientBuilder.create()
 *     .baseUrlFromEnv()
 *     .tokenFromEnv()
 *     .build();
 *
 * // With retries for transient failures
 * SonarQubeClientProperties props = new SonarQubeClientProperties();
 * props.setMaxRetries(3);
 *
 * SonarQubeClient client = SonarQubeClientBuilder.create()
 *     .baseUrl("https://sonar.example.com")
 *     .token("squ_xxxxx")
 *     .properties(props)
 *     .build();
 *
 * // For testing with a mock transport
 * SonarQubeTransport transport = mock(SonarQubeTransport.class);
 * SonarQubeClient testClient = SonarQubeClientBuilder.create()
 *     .transport(transport)
 *     .build();
 * }
 * </pre>
 */
public class SonarQubeClientBuilder {

	private static final Logger logger = LoggerFactory.getLogger(SonarQubeClientBuilder.class);

	private @Nullable String baseUrl;

	private @Nullable AuthProvider authProvider;

	private SonarQubeClientProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable SonarQubeTransport transport;

	private SonarQubeClientBuilder() {
		this.properties = new SonarQubeClientProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new SonarQubeClientBuilder
	 */
	public static SonarQubeClientBuilder create() {
		return new SonarQubeClientBuilder();
	}

	/**
	 * Set the server URL, for example {@code https://sonar.example.com}. Takes precedence
	 * over {@link SonarQubeClientProperties#getBaseUrl()}.
	 * @param baseUrl server URL
	 * @return this builder
	 */
	public SonarQubeClientBuilder baseUrl(String baseUrl) {
		this.baseUrl = baseUrl;
		return this;
	}

	/**
	 * Read the server URL from {@code SONAR_HOST_URL}.
	 * @return this builder
	 * @throws IllegalStateException if SONAR_HOST_URL is not set
	 */
	public SonarQubeClientBuilder baseUrlFromEnv() {
		String value = EnvironmentSupport.get(EnvironmentSupport.SONAR_HOST_URL);
		if (value == null) {
			throw new IllegalStateException("SONAR_HOST_URL environment variable is required. "
					+ "Please set the URL of your SonarQube server.");
		}
		this.baseUrl = value;
		return this;
	}

	/**
	 * Authenticate with a user token sent as a bearer token.
	 * @param token SonarQube user token
	 * @return this builder
	 */
	public SonarQubeClientBuilder token(String token) {
		this.authProvider = new BearerTokenAuthProvider(token);
		return this;
	}

	/**
	 * Read the token from {@code SONAR_TOKEN}.
	 * @return this builder
	 * @throws IllegalStateException if SONAR_TOKEN is not set
	 */
	public SonarQubeClientBuilder tokenFromEnv() {
		String value = EnvironmentSupport.get(EnvironmentSupport.SONAR_TOKEN);
		if (value == null) {
			throw new IllegalStateException(
					"SONAR_TOKEN environment variable is required. Please set your SonarQube user token.");
		}
		return token(value);
	}

	public SonarQubeClientBuilder basicAuth(String username, String password) {
		this.authProvider = new BasicAuthProvider(username, password);
		return this;
	}

	/**
	 * Authenticate with the system passcode, accepted by monitoring endpoints only.
	 * @param passcode system passcode
	 * @return this builder
	 */
	public SonarQubeClientBuilder passcode(String passcode) {
		this.authProvider = new PasscodeAuthProvider(passcode);
		return this;
	}

	/**
	 * Set client properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public SonarQubeClientBuilder properties(@Nullable SonarQubeClientProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public SonarQubeClientBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom transport. Useful for testing with mocks or for adding decorators.
	 *
	 * <p>
	 * When a custom transport is provided, the base URL, credentials and retry settings
	 * are not used.
	 * @param transport custom SonarQubeTransport implementation (null to use default)
	 * @return this builder
	 */
	public SonarQubeClientBuilder transport(@Nullable SonarQubeTransport transport) {
		this.transport = transport;
		return this;
	}

	/**
	 * Build the client.
	 * @return configured SonarQubeClient
	 * @throws IllegalStateException if no base URL is available
	 */
	public SonarQubeClient build() {
		Components components = buildComponents();
		return new SonarQubeClient(components.transport(), components.objectMapper(),
				new DeprecationRegistry(properties.getDeprecationPolicy()));
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		SonarQubeTransport resolved = this.transport != null ? this.transport : buildTransport(mapper);
		return new Components(resolved, mapper);
	}

	private SonarQubeTransport buildTransport(ObjectMapper mapper) {
		String url = this.baseUrl != null ? this.baseUrl : properties.getBaseUrl();
		if (url == null || url.isBlank()) {
			throw new IllegalStateException(
					"SonarQube base URL is required. Call baseUrl() or baseUrlFromEnv() first.");
		}
		AuthProvider auth = this.authProvider != null ? this.authProvider : NoAuthProvider.INSTANCE;
		SonarQubeTransport http = new HttpSonarQubeTransport(url, auth, properties, new ErrorClassifier(mapper));
		logger.debug("SonarQube client for {} using {} authentication", url, auth.getAuthType());
		if (properties.getMaxRetries() <= 0) {
			return http;
		}
		return RetryingSonarQubeTransport.builder()
			.wrapping(http)
			.maxRetries(properties.getMaxRetries())
			.initialDelay(properties.getRetryDelay())
			.maxRetryAfter(properties.getMaxRetryAfter())
			.build();
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(SonarQubeTransport transport, ObjectMapper objectMapper) {
	}

}
