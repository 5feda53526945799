package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Rejected request parameters.
 *
 * <p>
 * Raised either by the server (HTTP 400, with the messages it returned in
 * {@link #getErrors()}) or client-side before any request is sent, in which case
 * {@link #getStatusCode()} is null.
 */
public class ValidationException extends SonarQubeException {

	private final List<FieldError> errors;

	/**
	 * Client-side validation failure.
	 * @param message what was rejected
	 */
	public ValidationException(String message) {
		this(message, null);
	}

	/**
	 * Client-side validation failure for a single field.
	 * @param message what was rejected
	 * @param field the offending parameter, or null
	 */
	public ValidationException(String message, @Nullable String field) {
		super(ErrorKind.VALIDATION, message, null, null, Map.of(), null);
		this.errors = List.of(new FieldError(field, message));
	}

	/**
	 * Server-side validation failure (HTTP 400).
	 * @param message combined message
	 * @param errors individual messages as returned by the server
	 * @param responseBody raw body
	 * @param headers response headers
	 */
	public ValidationException(String message, List<FieldError> errors, @Nullable String responseBody,
			Map<String, List<String>> headers) {
		super(ErrorKind.VALIDATION, message, 400, responseBody, headers, null);
		this.errors = List.copyOf(errors);
	}

	/**
	 * Individual validation messages, verbatim.
	 * @return the errors, possibly empty
	 */
	public List<FieldError> getErrors() {
		return errors;
	}

	/**
	 * A single validation message.
	 *
	 * @param field the parameter the message refers to, when known
	 * @param message the message
	 */
	public record FieldError(@Nullable String field, String message) {
	}

}
