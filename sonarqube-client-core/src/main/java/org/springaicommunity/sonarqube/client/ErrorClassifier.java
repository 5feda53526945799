package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a failed HTTP exchange into exactly one {@link SonarQubeException}.
 *
 * <p>
 * Classification never throws: a body that is not JSON, or JSON that does not follow the
 * SonarQube {@code {"errors":[{"msg":"..."}]}} convention, degrades to its raw text or to
 * a default {@code HTTP <status>} message. The transport is responsible for throwing the
 * result.
 *
 * <table>
 * <caption>Status mapping</caption>
 * <tr><th>Status</th><th>Exception</th></tr>
 * <tr><td>400</td><td>{@link ValidationException}</td></tr>
 * <tr><td>401</td><td>{@link AuthenticationException}</td></tr>
 * <tr><td>403</td><td>{@link AuthorizationException}</td></tr>
 * <tr><td>404</td><td>{@link NotFoundException}</td></tr>
 * <tr><td>410</td><td>{@link RemovedApiException}</td></tr>
 * <tr><td>429</td><td>{@link RateLimitException}</td></tr>
 * <tr><td>503 (indexing)</td><td>{@link IndexingInProgressException}</td></tr>
 * <tr><td>500-599</td><td>{@link ServerException}</td></tr>
 * <tr><td>other</td><td>{@link ApiException}</td></tr>
 * </table>
 */
public final class ErrorClassifier {

	private static final Logger logger = LoggerFactory.getLogger(ErrorClassifier.class);

	static final int MAX_TEXT_MESSAGE_LENGTH = 500;

	private static final List<String> REQUEST_ID_HEADERS = List.of("X-Request-Id", "X-Sonar-Request-Id",
			"Request-Id");

	private final ObjectMapper objectMapper;

	public ErrorClassifier() {
		this(new ObjectMapper());
	}

	public ErrorClassifier(ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
	}

	/**
	 * Classify a non-2xx response.
	 * @param status HTTP status code
	 * @param body response body, may be null or empty
	 * @param headers response headers, names matched case-insensitively
	 * @return the typed exception, never null
	 */
	public SonarQubeException classify(int status, @Nullable String body, Map<String, List<String>> headers) {
		return classify(status, body, headers, null);
	}

	/**
	 * Classify a non-2xx response to a known endpoint. The path names the removed
	 * capability when the server answers 410.
	 * @param status HTTP status code
	 * @param body response body, may be null or empty
	 * @param headers response headers, names matched case-insensitively
	 * @param path request path, e.g. {@code /api/user_properties/index}, or null
	 * @return the typed exception, never null
	 */
	public SonarQubeException classify(int status, @Nullable String body, Map<String, List<String>> headers,
			@Nullable String path) {
		ParsedBody parsed = parse(body);
		String message = message(status, body, parsed);

		switch (status) {
			case 400:
				return new ValidationException(message, parsed.fieldErrors(), body, headers);
			case 401:
				return new AuthenticationException(message, body, headers);
			case 403:
				return new AuthorizationException(message, body, headers);
			case 404:
				return new NotFoundException(message, body, headers);
			case 410:
				return removedByServer(message, status, body, headers, path);
			case 429:
				return new RateLimitException(message, parseRetryAfter(firstHeader(headers, "Retry-After")), body,
						headers);
			default:
				break;
		}
		if (status >= 500 && status <= 599) {
			String requestId = requestId(headers);
			if (status == 503 && isIndexingMessage(message)) {
				return new IndexingInProgressException(message, requestId, body, headers);
			}
			return new ServerException(message, status, requestId, body, headers);
		}
		return new ApiException(message, status, body, headers);
	}

	/**
	 * Classify a failure that happened before any HTTP response was received.
	 * @param cause the transport failure
	 * @return {@link RequestTimeoutException} for timeouts, {@link NetworkException}
	 * otherwise
	 */
	public SonarQubeException classifyTransportFailure(Throwable cause) {
		if (cause instanceof SonarQubeException) {
			return (SonarQubeException) cause;
		}
		if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
			return new RequestTimeoutException("Request timed out: " + describe(cause), cause);
		}
		return new NetworkException("Network error: " + describe(cause), cause);
	}

	/**
	 * Build the error a resource client raises for an endpoint it knows to be gone, without
	 * contacting the server.
	 * @param capability the removed endpoint or feature, e.g. {@code api/user_properties}
	 * @param sinceVersion version that removed it
	 * @param migration replacement capability mapped to usage guidance, in order
	 * @return the exception to throw
	 */
	public static RemovedApiException removedApi(String capability, String sinceVersion,
			Map<String, String> migration) {
		StringBuilder message = new StringBuilder().append(capability)
			.append(" was removed in SonarQube ")
			.append(sinceVersion);
		if (!migration.isEmpty()) {
			message.append(". Use ").append(String.join(" or ", migration.keySet())).append(" instead");
		}
		return new RemovedApiException(message.toString(), capability, sinceVersion, migration, null, Map.of());
	}

	private static RemovedApiException removedByServer(String message, int status, @Nullable String body,
			Map<String, List<String>> headers, @Nullable String path) {
		if (path == null || path.isBlank()) {
			return new RemovedApiException(message, null, null, Map.of(), body, headers);
		}
		String capability = path.startsWith("/") ? path.substring(1) : path;
		String removed = capability + " was removed";
		if (!message.equals(defaultMessage(status))) {
			removed = removed + ": " + message;
		}
		return new RemovedApiException(removed, capability, null, Map.of(), body, headers);
	}

	/**
	 * First value of a header, ignoring the case of its name.
	 * @param headers headers as returned by the transport
	 * @param name header name
	 * @return the value, or null if absent
	 */
	@Nullable
	public static String firstHeader(Map<String, List<String>> headers, String name) {
		for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
			if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name) && entry.getValue() != null
					&& !entry.getValue().isEmpty()) {
				return entry.getValue().get(0);
			}
		}
		return null;
	}

	@Nullable
	static Integer parseRetryAfter(@Nullable String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			int seconds = Integer.parseInt(value.trim());
			return seconds >= 0 ? seconds : null;
		}
		catch (NumberFormatException e) {
			// HTTP-date form is not supported
			return null;
		}
	}

	static boolean isIndexingMessage(String message) {
		String lower = message.toLowerCase(Locale.ROOT);
		return lower.contains("indexing in progress") || lower.contains("issues index")
				|| lower.contains("index is not ready") || (lower.contains("index") && lower.contains("progress"));
	}

	@Nullable
	private static String requestId(Map<String, List<String>> headers) {
		for (String name : REQUEST_ID_HEADERS) {
			String value = firstHeader(headers, name);
			if (value != null && !value.isBlank()) {
				return value;
			}
		}
		return null;
	}

	private static String message(int status, @Nullable String body, ParsedBody parsed) {
		if (!parsed.messages().isEmpty()) {
			return String.join(", ", parsed.messages());
		}
		if (body == null || body.isBlank()) {
			return defaultMessage(status);
		}
		if (parsed.json()) {
			// JSON without the errors convention says nothing useful to a caller
			return defaultMessage(status);
		}
		String text = body.strip();
		return text.length() > MAX_TEXT_MESSAGE_LENGTH ? text.substring(0, MAX_TEXT_MESSAGE_LENGTH) : text;
	}

	private static String defaultMessage(int status) {
		return "HTTP " + status;
	}

	private ParsedBody parse(@Nullable String body) {
		if (body == null || body.isBlank()) {
			return ParsedBody.EMPTY;
		}
		String trimmed = body.strip();
		if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
			return ParsedBody.EMPTY;
		}
		try {
			JsonNode root = objectMapper.readTree(trimmed);
			List<String> messages = new ArrayList<>();
			List<ValidationException.FieldError> fieldErrors = new ArrayList<>();
			JsonNode errors = root.path("errors");
			if (errors.isArray()) {
				for (JsonNode error : errors) {
					String msg = error.path("msg").asText(null);
					if (msg == null) {
						continue;
					}
					String field = error.hasNonNull("field") ? error.get("field").asText() : null;
					messages.add(msg);
					fieldErrors.add(new ValidationException.FieldError(field, msg));
				}
			}
			return new ParsedBody(true, messages, fieldErrors);
		}
		catch (JsonProcessingException e) {
			logger.debug("Error body is not valid JSON, using raw text: {}", e.getOriginalMessage());
			return ParsedBody.EMPTY;
		}
	}

	private static String describe(Throwable cause) {
		String message = cause.getMessage();
		return message != null ? message : cause.getClass().getSimpleName();
	}

	private record ParsedBody(boolean json, List<String> messages, List<ValidationException.FieldError> fieldErrors) {

		static final ParsedBody EMPTY = new ParsedBody(false, List.of(), List.of());

	}

}
