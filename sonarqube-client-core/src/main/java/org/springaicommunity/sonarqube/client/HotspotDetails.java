package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Full description of a hotspot as returned by {@code api/hotspots/show}.
 */
public record HotspotDetails(String key, Component component, @Nullable Component project, Rule rule, String status,
		@Nullable String resolution, @Nullable Integer line, @Nullable String message, @Nullable String assignee,
		@Nullable String author, @Nullable String creationDate, @Nullable String updateDate,
		@Nullable TextRange textRange, List<IssueComment> comment, List<ChangelogEntry> changelog) {

	public HotspotDetails {
		comment = comment != null ? List.copyOf(comment) : List.of();
		changelog = changelog != null ? List.copyOf(changelog) : List.of();
	}

	/**
	 * Rule of a hotspot with its security guidance.
	 */
	public record Rule(String key, @Nullable String name, @Nullable String securityCategory,
			@Nullable String vulnerabilityProbability, @Nullable String riskDescription,
			@Nullable String vulnerabilityDescription, @Nullable String fixRecommendations) {
	}

}
