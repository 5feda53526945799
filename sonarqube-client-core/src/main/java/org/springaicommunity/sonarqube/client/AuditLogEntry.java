package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * One entry of the audit log. Only available on Enterprise Edition and above.
 *
 * @param id entry identifier
 * @param timestamp ISO-8601 time of the event
 * @param userLogin login of the acting user
 * @param userName name of the acting user
 * @param category event category, for example {@code AUTH} or {@code PERMISSION}
 * @param action event action, for example {@code LOGIN} or {@code GRANT_PERMISSION}
 * @param resource affected resource
 * @param details free-form details as sent by the server
 * @param ipAddress client address
 * @param userAgent client user agent
 */
public record AuditLogEntry(String id, String timestamp, @Nullable String userLogin, @Nullable String userName,
		String category, String action, @Nullable String resource, @Nullable JsonNode details,
		@Nullable String ipAddress, @Nullable String userAgent) {
}
