package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/system}: liveness, health and version of the server.
 *
 * <p>
 * {@link #ping()} and {@link #status()} are open to anonymous users. {@link #health()}
 * needs a system passcode or the system administration permission, and {@link #info()}
 * the system administration permission.
 */
public class SystemClient extends ResourceClient {

	static final String PONG = "pong";

	public SystemClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	/**
	 * Answers {@code pong} as plain text while the web server is up.
	 * @return the response text
	 */
	public String ping() {
		return getText("/api/system/ping", QueryParameters.create()).strip();
	}

	/**
	 * Whether the server answers a ping. Transport failures still propagate.
	 * @return true if the server answered {@code pong}
	 */
	public boolean isAlive() {
		return PONG.equals(ping());
	}

	public Health health() {
		return getJson("/api/system/health", QueryParameters.create(), Health.class);
	}

	public Status status() {
		return getJson("/api/system/status", QueryParameters.create(), Status.class);
	}

	/**
	 * Detailed system information. Sections and their keys vary between editions and
	 * versions, so the document is returned as a tree.
	 * @return the system information
	 */
	public JsonNode info() {
		return getTree("/api/system/info", QueryParameters.create());
	}

	/**
	 * @param health {@code GREEN}, {@code YELLOW} or {@code RED}
	 * @param causes reasons for a status other than {@code GREEN}
	 */
	public record Health(String health, List<Cause> causes) {

		public Health {
			causes = causes != null ? List.copyOf(causes) : List.of();
		}

		public boolean isGreen() {
			return "GREEN".equals(health);
		}

	}

	public record Cause(String message) {
	}

	/**
	 * @param id server id
	 * @param version server version, e.g. {@code 10.4.1.88267}
	 * @param status {@code STARTING}, {@code UP}, {@code DOWN}, {@code RESTARTING},
	 * {@code DB_MIGRATION_NEEDED} or {@code DB_MIGRATION_RUNNING}
	 */
	public record Status(@Nullable String id, @Nullable String version, String status) {

		public boolean isUp() {
			return "UP".equals(status);
		}

	}

}
