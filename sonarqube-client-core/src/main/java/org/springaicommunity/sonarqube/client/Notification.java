package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

/**
 * Notification subscription of a user.
 *
 * @param channel delivery channel, for example {@code EmailNotificationChannel}
 * @param type notification type, for example {@code NewIssues}
 * @param organization organization, on SonarCloud only
 * @param project project key for per-project subscriptions, null for global ones
 * @param projectName project name
 */
public record Notification(String channel, String type, @Nullable String organization, @Nullable String project,
		@Nullable String projectName) {
}
