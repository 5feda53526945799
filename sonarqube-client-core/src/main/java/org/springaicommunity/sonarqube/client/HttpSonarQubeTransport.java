package org.springaicommunity.sonarqube.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link SonarQubeTransport} on top of the JDK {@link HttpClient}.
 *
 * <p>
 * Every non-2xx response and every I/O failure is turned into a
 * {@link SonarQubeException} by the {@link ErrorClassifier} and thrown.
 */
public class HttpSonarQubeTransport implements SonarQubeTransport {

	private static final Logger logger = LoggerFactory.getLogger(HttpSonarQubeTransport.class);

	private final HttpClient httpClient;

	private final String baseUrl;

	private final AuthProvider authProvider;

	private final ErrorClassifier errorClassifier;

	private final Duration requestTimeout;

	private final String userAgent;

	public HttpSonarQubeTransport(String baseUrl, AuthProvider authProvider) {
		this(baseUrl, authProvider, new SonarQubeClientProperties(), new ErrorClassifier());
	}

	public HttpSonarQubeTransport(String baseUrl, AuthProvider authProvider, SonarQubeClientProperties properties,
			ErrorClassifier errorClassifier) {
		this(HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(properties.getConnectTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), baseUrl, authProvider, properties, errorClassifier);
	}

	HttpSonarQubeTransport(HttpClient httpClient, String baseUrl, AuthProvider authProvider,
			SonarQubeClientProperties properties, ErrorClassifier errorClassifier) {
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
		this.baseUrl = normalizeBaseUrl(baseUrl);
		this.authProvider = Objects.requireNonNull(authProvider, "authProvider");
		this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
		this.requestTimeout = properties.getRequestTimeout();
		this.userAgent = properties.getUserAgent();
	}

	public String getBaseUrl() {
		return baseUrl;
	}

	@Override
	public String get(String path, QueryParameters query) {
		HttpRequest request = newRequest(uri(path, query)).header("Accept", "application/json, text/plain, */*")
			.GET()
			.build();
		return send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8), "GET", path);
	}

	@Override
	public byte[] getBytes(String path, QueryParameters query) {
		HttpRequest request = newRequest(uri(path, query)).header("Accept", "*/*").GET().build();
		return send(request, HttpResponse.BodyHandlers.ofByteArray(), "GET", path);
	}

	@Override
	public String post(String path, QueryParameters form) {
		HttpRequest request = newRequest(uri(path, QueryParameters.create()))
			.header("Content-Type", "application/x-www-form-urlencoded")
			.header("Accept", "application/json, text/plain, */*")
			.POST(HttpRequest.BodyPublishers.ofString(form.toQueryString(), StandardCharsets.UTF_8))
			.build();
		return send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8), "POST", path);
	}

	private HttpRequest.Builder newRequest(URI uri) {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(requestTimeout)
			.header("User-Agent", userAgent);
		return authProvider.applyAuth(builder);
	}

	private URI uri(String path, QueryParameters query) {
		String normalizedPath = path.startsWith("/") ? path : "/" + path;
		String queryString = query.toQueryString();
		String url = baseUrl + normalizedPath;
		return URI.create(queryString.isEmpty() ? url : url + "?" + queryString);
	}

	private <T> T send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler, String method, String path) {
		logger.debug("{} {}", method, request.uri());
		long start = System.currentTimeMillis();
		HttpResponse<T> response;
		try {
			response = httpClient.send(request, bodyHandler);
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", method, request.uri(), System.currentTimeMillis() - start,
					e.getMessage());
			throw errorClassifier.classifyTransportFailure(e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new NetworkException("HTTP request interrupted", e);
		}

		int status = response.statusCode();
		logger.debug("{} {} completed with {} in {}ms", method, request.uri(), status,
				System.currentTimeMillis() - start);
		if (status >= 200 && status < 300) {
			return response.body();
		}

		String body = bodyAsText(response.body());
		SonarQubeException error = errorClassifier.classify(status, body, response.headers().map(), path);
		logger.warn("{} {} failed: {} ({})", method, request.uri().getPath(), error.getMessage(), error.getKind());
		throw error;
	}

	private static String bodyAsText(Object body) {
		if (body instanceof byte[]) {
			return new String((byte[]) body, StandardCharsets.UTF_8);
		}
		return String.valueOf(body);
	}

	static String normalizeBaseUrl(String baseUrl) {
		if (baseUrl == null || baseUrl.isBlank()) {
			throw new IllegalArgumentException("Base URL must not be blank");
		}
		String url = baseUrl.trim();
		while (url.endsWith("/")) {
			url = url.substring(0, url.length() - 1);
		}
		return url;
	}

}
