package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

/**
 * A security hotspot as listed by {@code api/hotspots/search}.
 *
 * @param key unique hotspot key
 * @param component key of the file
 * @param project key of the project
 * @param securityCategory e.g. {@code sql-injection}
 * @param vulnerabilityProbability {@code HIGH}, {@code MEDIUM} or {@code LOW}
 * @param status {@code TO_REVIEW} or {@code REVIEWED}
 * @param resolution resolution of reviewed hotspots
 * @param line line of the hotspot
 * @param message hotspot message
 * @param assignee login of the assignee
 * @param author SCM author
 * @param creationDate creation date
 * @param updateDate date of the last change
 * @param textRange precise location
 * @param ruleKey key of the rule that raised it
 */
public record Hotspot(String key, String component, @Nullable String project, @Nullable String securityCategory,
		@Nullable String vulnerabilityProbability, String status, @Nullable String resolution, @Nullable Integer line,
		@Nullable String message, @Nullable String assignee, @Nullable String author, @Nullable String creationDate,
		@Nullable String updateDate, @Nullable TextRange textRange, @Nullable String ruleKey) {
}
