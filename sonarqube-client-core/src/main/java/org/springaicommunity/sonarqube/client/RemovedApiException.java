package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The endpoint no longer exists, either reported by the server (HTTP 410) or known to a
 * resource client that refuses to call it.
 *
 * <p>
 * {@link #getMigration()} maps each replacement capability to guidance on how to use it.
 */
public class RemovedApiException extends SonarQubeException {

	private final @Nullable String capability;

	private final @Nullable String removedIn;

	private final Map<String, String> migration;

	public RemovedApiException(String message, @Nullable String capability, @Nullable String removedIn,
			Map<String, String> migration, @Nullable String responseBody, Map<String, List<String>> headers) {
		super(ErrorKind.REMOVED_API, message, 410, responseBody, headers, null);
		this.capability = capability;
		this.removedIn = removedIn;
		this.migration = Collections.unmodifiableMap(new LinkedHashMap<>(migration));
	}

	/**
	 * The removed capability.
	 * @return the capability, or null if the server did not say
	 */
	@Nullable
	public String getCapability() {
		return capability;
	}

	/**
	 * Version in which the capability was removed.
	 * @return the version, or null if unknown
	 */
	@Nullable
	public String getRemovedIn() {
		return removedIn;
	}

	public Map<String, String> getMigration() {
		return migration;
	}

	/**
	 * Names of the capabilities that replace the removed one.
	 * @return the replacements in declaration order, possibly empty
	 */
	public List<String> getReplacements() {
		return List.copyOf(migration.keySet());
	}

}
