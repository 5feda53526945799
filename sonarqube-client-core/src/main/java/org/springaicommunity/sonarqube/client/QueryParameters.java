package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Ordered set of named query values accumulated before a request is sent.
 *
 * <p>
 * Values may be strings, numbers, booleans, enums or collections of those. Setting a name
 * twice replaces the previous value and setting {@code null} is ignored. Collections are
 * kept as lists and joined with commas only when the bag is serialized, which is the
 * convention of the SonarQube Web API.
 *
 * <p>
 * Not thread-safe. Builders hand a {@link #copy()} to their executor so that later changes
 * do not leak into a request that is already under way.
 */
public final class QueryParameters {

	private final Map<String, Object> values;

	public QueryParameters() {
		this.values = new LinkedHashMap<>();
	}

	private QueryParameters(Map<String, Object> values) {
		this.values = new LinkedHashMap<>(values);
	}

	/**
	 * Create an empty parameter bag.
	 * @return new QueryParameters
	 */
	public static QueryParameters create() {
		return new QueryParameters();
	}

	/**
	 * Store a value, replacing any previous value for the same name.
	 * @param name parameter name
	 * @param value parameter value; {@code null} leaves the bag unchanged
	 * @return this bag
	 */
	public QueryParameters set(String name, @Nullable Object value) {
		Objects.requireNonNull(name, "name");
		if (value == null) {
			return this;
		}
		if (value instanceof Collection) {
			values.put(name, List.copyOf((Collection<?>) value));
		}
		else if (value instanceof Object[]) {
			values.put(name, List.of((Object[]) value));
		}
		else {
			values.put(name, value);
		}
		return this;
	}

	@Nullable
	public Object get(String name) {
		return values.get(name);
	}

	public boolean contains(String name) {
		return values.containsKey(name);
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	/**
	 * Unmodifiable view of the stored values in insertion order.
	 * @return the values
	 */
	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(values);
	}

	/**
	 * Independent snapshot of this bag.
	 * @return the copy
	 */
	public QueryParameters copy() {
		return new QueryParameters(values);
	}

	/**
	 * Serialize to a URL-encoded query string without the leading {@code ?}. Collections are
	 * joined with commas and empty collections are left out.
	 * @return the query string, empty if there is nothing to send
	 */
	public String toQueryString() {
		StringJoiner joiner = new StringJoiner("&");
		for (Map.Entry<String, Object> entry : values.entrySet()) {
			String formatted = format(entry.getValue());
			if (formatted == null) {
				continue;
			}
			joiner.add(encode(entry.getKey()) + "=" + encode(formatted));
		}
		return joiner.toString();
	}

	@Nullable
	static String format(Object value) {
		if (value instanceof Collection) {
			Collection<?> collection = (Collection<?>) value;
			if (collection.isEmpty()) {
				return null;
			}
			return collection.stream().map(QueryParameters::formatScalar).collect(Collectors.joining(","));
		}
		return formatScalar(value);
	}

	private static String formatScalar(Object value) {
		if (value instanceof WireValue) {
			return ((WireValue) value).wireValue();
		}
		if (value instanceof Enum) {
			return ((Enum<?>) value).name();
		}
		return String.valueOf(value);
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	@Override
	public boolean equals(@Nullable Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof QueryParameters)) {
			return false;
		}
		return values.equals(((QueryParameters) o).values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return "QueryParameters" + values;
	}

}
