package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One change of an issue, as returned by {@code api/issues/changelog}.
 */
public record ChangelogEntry(@Nullable String user, @Nullable String userName, @Nullable String creationDate,
		List<Diff> diffs) {

	public ChangelogEntry {
		diffs = diffs != null ? List.copyOf(diffs) : List.of();
	}

	/**
	 * Change of a single field.
	 */
	public record Diff(String key, @Nullable String oldValue, @Nullable String newValue) {
	}

}
