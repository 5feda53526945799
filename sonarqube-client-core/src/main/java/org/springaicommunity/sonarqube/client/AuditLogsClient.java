package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Client for {@code api/audit_logs}, available on Enterprise Edition and above.
 */
public class AuditLogsClient extends ResourceClient {

	private static final Logger logger = LoggerFactory.getLogger(AuditLogsClient.class);

	static final String SEARCH_PATH = "/api/audit_logs/search";

	public AuditLogsClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public AuditLogSearchBuilder search() {
		return new AuditLogSearchBuilder(this::search);
	}

	public AuditLogSearchResponse search(QueryParameters params) {
		return getJson(SEARCH_PATH, params, AuditLogSearchResponse.class);
	}

	/**
	 * Download the audit log of a period as a file.
	 * @param from ISO-8601 lower bound, or null
	 * @param to ISO-8601 upper bound, or null
	 * @param format {@code csv} or {@code json}, or null for the server default
	 * @return the raw file content
	 */
	public byte[] download(@Nullable String from, @Nullable String to, @Nullable String format) {
		QueryParameters query = QueryParameters.create().set("from", from).set("to", to).set("format", format);
		return getBytes("/api/audit_logs/download", query);
	}

	/**
	 * Whether the server exposes audit logs at all. Editions without them answer the search
	 * endpoint with 404. Any other failure propagates.
	 * @return true if a one-item search succeeds
	 */
	public boolean isAvailable() {
		try {
			search().pageSize(1).execute();
			return true;
		}
		catch (NotFoundException ex) {
			logger.debug("Audit logs not available: {}", ex.getMessage());
			return false;
		}
	}

	/**
	 * Page of {@code api/audit_logs/search}. Paging is reported under {@code page} with
	 * different field names than elsewhere.
	 *
	 * @param auditLogs entries on this page
	 * @param page paging block as sent by the server
	 */
	public record AuditLogSearchResponse(List<AuditLogEntry> auditLogs, @Nullable PageBlock page)
			implements Paged<AuditLogEntry> {

		public AuditLogSearchResponse {
			auditLogs = auditLogs != null ? List.copyOf(auditLogs) : List.of();
		}

		@Override
		public List<AuditLogEntry> items() {
			return auditLogs;
		}

		@Override
		@Nullable
		public Paging paging() {
			return page != null ? new Paging(page.pageIndex(), page.pageSize(), page.totalItems()) : null;
		}

	}

	public record PageBlock(int pageIndex, int pageSize, int totalItems, int totalPages) {
	}

}
