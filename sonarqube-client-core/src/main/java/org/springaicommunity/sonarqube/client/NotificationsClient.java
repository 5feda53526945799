package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/notifications}.
 *
 * <p>
 * Every operation acts on the authenticated user unless a {@code login} is given, which
 * requires administer permission.
 */
public class NotificationsClient extends ResourceClient {

	/**
	 * Channel used when none is given.
	 */
	public static final String EMAIL_CHANNEL = "EmailNotificationChannel";

	public NotificationsClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public NotificationList list(@Nullable String login) {
		return getJson("/api/notifications/list", QueryParameters.create().set("login", login),
				NotificationList.class);
	}

	public NotificationList list() {
		return list(null);
	}

	/**
	 * Subscribe to a notification.
	 * @param type notification type
	 * @param channel channel, or null for email
	 * @param project project key for a per-project subscription, or null for a global one
	 * @param login user, or null for the authenticated user
	 */
	public void add(String type, @Nullable String channel, @Nullable String project, @Nullable String login) {
		post("/api/notifications/add", form(type, channel, project, login));
	}

	public void remove(String type, @Nullable String channel, @Nullable String project, @Nullable String login) {
		post("/api/notifications/remove", form(type, channel, project, login));
	}

	private static QueryParameters form(String type, @Nullable String channel, @Nullable String project,
			@Nullable String login) {
		return QueryParameters.create()
			.set("type", Validation.requireNonBlank(type, "type"))
			.set("channel", channel)
			.set("project", project)
			.set("login", login);
	}

	/**
	 * @param notifications current subscriptions
	 * @param channels available channels
	 * @param globalTypes types that can be subscribed globally
	 * @param perProjectTypes types that can be subscribed per project
	 */
	public record NotificationList(List<Notification> notifications, List<String> channels,
			List<String> globalTypes, List<String> perProjectTypes) {

		public NotificationList {
			notifications = notifications != null ? List.copyOf(notifications) : List.of();
			channels = channels != null ? List.copyOf(channels) : List.of();
			globalTypes = globalTypes != null ? List.copyOf(globalTypes) : List.of();
			perProjectTypes = perProjectTypes != null ? List.copyOf(perProjectTypes) : List.of();
		}

	}

}
