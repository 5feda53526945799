package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Tracks use of deprecated Web API parameters and operations for one client.
 *
 * <p>
 * Every usage is recorded under a key such as {@code api/issues/search#statuses}. Under
 * {@link DeprecationPolicy#WARN} a warning is logged once per key for the lifetime of the
 * registry. Under {@link DeprecationPolicy#STRICT} every usage fails. Thread-safe.
 */
public final class DeprecationRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DeprecationRegistry.class);

	private final DeprecationPolicy policy;

	private final Set<String> reported = new LinkedHashSet<>();

	public DeprecationRegistry(DeprecationPolicy policy) {
		this.policy = Objects.requireNonNull(policy, "policy");
	}

	public DeprecationPolicy getPolicy() {
		return policy;
	}

	/**
	 * Record a deprecated usage.
	 * @param api key of the deprecated parameter or operation
	 * @param replacement what to use instead, or null if there is nothing
	 * @param field request parameter reported in a strict-mode failure
	 * @throws ValidationException under {@link DeprecationPolicy#STRICT}
	 */
	public void report(String api, @Nullable String replacement, String field) {
		boolean first;
		synchronized (reported) {
			first = reported.add(api);
		}
		String message = replacement != null ? api + " is deprecated. Use " + replacement + " instead."
				: api + " is deprecated.";
		switch (policy) {
			case STRICT:
				throw new ValidationException(message, field);
			case WARN:
				if (first) {
					logger.warn(message);
				}
				break;
			default:
				logger.debug(message);
				break;
		}
	}

	public boolean hasReported(String api) {
		synchronized (reported) {
			return reported.contains(api);
		}
	}

	/**
	 * Keys reported so far, in first-use order.
	 * @return snapshot of the reported keys
	 */
	public Set<String> getReported() {
		synchronized (reported) {
			return Collections.unmodifiableSet(new LinkedHashSet<>(reported));
		}
	}

	/**
	 * Forget the reported keys, so that each usage warns again.
	 */
	public void clear() {
		synchronized (reported) {
			reported.clear();
		}
	}

}
