package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of every failure raised by this client.
 *
 * <p>
 * Instances are created by {@link ErrorClassifier} at the transport boundary, or directly
 * by a builder or resource client when arguments are rejected before a request is sent.
 * Callers branch on the concrete subtype or on {@link #getKind()} rather than on the
 * message.
 */
public abstract class SonarQubeException extends RuntimeException {

	private final ErrorKind kind;

	private final @Nullable Integer statusCode;

	private final @Nullable String responseBody;

	private final Map<String, List<String>> headers;

	protected SonarQubeException(ErrorKind kind, String message, @Nullable Integer statusCode,
			@Nullable String responseBody, Map<String, List<String>> headers, @Nullable Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.headers = copyHeaders(headers);
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * HTTP status of the failed response.
	 * @return the status, or null if no response was received or the failure was raised
	 * client-side
	 */
	@Nullable
	public Integer getStatusCode() {
		return statusCode;
	}

	/**
	 * Raw body of the failed response.
	 * @return the body, or null if none was received
	 */
	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public Map<String, List<String>> getHeaders() {
		return headers;
	}

	/**
	 * First value of a response header, matched case-insensitively.
	 * @param name header name
	 * @return the value, or null if absent
	 */
	@Nullable
	public String getHeader(String name) {
		return ErrorClassifier.firstHeader(headers, name);
	}

	/**
	 * Headers may come from any HTTP stack, so entries without a name, null values and
	 * null list elements are dropped.
	 */
	private static Map<String, List<String>> copyHeaders(Map<String, List<String>> headers) {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
			if (entry.getKey() == null || entry.getValue() == null) {
				continue;
			}
			List<String> values = new ArrayList<>(entry.getValue());
			values.removeIf(Objects::isNull);
			copy.put(entry.getKey(), Collections.unmodifiableList(values));
		}
		return Collections.unmodifiableMap(copy);
	}

}
