package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.Collection;

/**
 * Argument checks shared by builders and resource clients. Every check fails with a
 * {@link ValidationException} that carries no status code, before any request is sent.
 */
public final class Validation {

	private Validation() {
	}

	/**
	 * Require a non-blank string argument.
	 * @param value the value to check
	 * @param field parameter name, used in the message
	 * @return the value
	 */
	public static String requireNonBlank(@Nullable String value, String field) {
		if (value == null || value.isBlank()) {
			throw new ValidationException(field + " is required", field);
		}
		return value;
	}

	/**
	 * Require a non-empty collection argument.
	 * @param values the values to check
	 * @param field parameter name, used in the message
	 * @param <C> collection type
	 * @return the values
	 */
	public static <C extends Collection<?>> C requireNonEmpty(@Nullable C values, String field) {
		if (values == null || values.isEmpty()) {
			throw new ValidationException(field + " must contain at least one value", field);
		}
		return values;
	}

	/**
	 * Reject two mutually exclusive arguments being given together.
	 * @param fieldA first parameter name
	 * @param valueA first value, null when absent
	 * @param fieldB second parameter name
	 * @param valueB second value, null when absent
	 */
	public static void requireAtMostOne(String fieldA, @Nullable Object valueA, String fieldB,
			@Nullable Object valueB) {
		if (valueA != null && valueB != null) {
			throw new ValidationException(fieldA + " and " + fieldB + " cannot be used together", fieldB);
		}
	}

	/**
	 * Require a minimum length for free-text search arguments.
	 * @param value the value to check, null when absent
	 * @param minLength minimum number of characters
	 * @param field parameter name, used in the message
	 */
	public static void requireMinLength(@Nullable String value, int minLength, String field) {
		if (value != null && value.length() < minLength) {
			throw new ValidationException(field + " must be at least " + minLength + " characters long", field);
		}
	}

}
