package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * An issue as returned by {@code api/issues/search} and the issue write endpoints.
 *
 * <p>
 * Dates are kept as returned by the server ({@code 2024-01-31T10:15:00+0100}).
 * {@code severity} and {@code type} belong to the legacy model and are superseded by
 * {@code impacts} on recent servers.
 *
 * @param key unique issue key
 * @param rule rule key, e.g. {@code java:S1068}
 * @param severity legacy severity
 * @param component key of the file the issue is on
 * @param project key of the project
 * @param line line of the issue, absent for file-level issues
 * @param textRange precise location
 * @param status legacy status
 * @param issueStatus status of the current model
 * @param resolution resolution of resolved issues
 * @param message issue message
 * @param effort remediation effort, e.g. {@code 5min}
 * @param assignee login of the assignee
 * @param author SCM author
 * @param tags tags, possibly empty
 * @param transitions transitions available to the current user
 * @param comments comments, when requested through {@code additionalFields}
 * @param creationDate creation date
 * @param updateDate date of the last change
 * @param closeDate close date of closed issues
 * @param type legacy type
 * @param cleanCodeAttribute clean code attribute
 * @param cleanCodeAttributeCategory clean code attribute category
 * @param impacts software quality impacts, possibly empty
 */
public record Issue(String key, String rule, @Nullable String severity, String component, @Nullable String project,
		@Nullable Integer line, @Nullable TextRange textRange, @Nullable String status, @Nullable String issueStatus,
		@Nullable String resolution, @Nullable String message, @Nullable String effort, @Nullable String assignee,
		@Nullable String author, List<String> tags, List<String> transitions, List<IssueComment> comments,
		@Nullable String creationDate, @Nullable String updateDate, @Nullable String closeDate, @Nullable String type,
		@Nullable String cleanCodeAttribute, @Nullable String cleanCodeAttributeCategory, List<Impact> impacts) {

	public Issue {
		tags = tags != null ? List.copyOf(tags) : List.of();
		transitions = transitions != null ? List.copyOf(transitions) : List.of();
		comments = comments != null ? List.copyOf(comments) : List.of();
		impacts = impacts != null ? List.copyOf(impacts) : List.of();
	}

}
