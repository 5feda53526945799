package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

public record IssueComment(String key, @Nullable String login, @Nullable String htmlText, @Nullable String markdown,
		boolean updatable, @Nullable String createdAt) {
}
