package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Quality gate status of a project, branch or pull request.
 *
 * @param status {@code OK}, {@code ERROR} or {@code NONE}
 * @param conditions evaluated conditions
 * @param ignoredConditions whether conditions were ignored because the new code is small
 * @param caycStatus Clean as You Code compliance
 */
public record ProjectStatus(String status, List<ConditionStatus> conditions, @Nullable Boolean ignoredConditions,
		@Nullable String caycStatus) {

	public ProjectStatus {
		conditions = conditions != null ? List.copyOf(conditions) : List.of();
	}

	public boolean passed() {
		return "OK".equals(status);
	}

	/**
	 * Outcome of one condition.
	 */
	public record ConditionStatus(String status, String metricKey, @Nullable String comparator,
			@Nullable Integer periodIndex, @Nullable String errorThreshold, @Nullable String actualValue) {
	}

}
