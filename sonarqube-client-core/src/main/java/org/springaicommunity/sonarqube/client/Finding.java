package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Issue or hotspot as exported by {@code api/projects/export_findings}.
 */
public record Finding(String key, @Nullable String type, @Nullable String severity, @Nullable String status,
		String component, @Nullable Integer line, @Nullable String message, @Nullable String rule,
		@Nullable String effort, List<String> tags, @Nullable String creationDate, @Nullable String updateDate,
		@Nullable String author, @Nullable String assignee) {

	public Finding {
		tags = tags != null ? List.copyOf(tags) : List.of();
	}

}
