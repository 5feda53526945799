package org.springaicommunity.sonarqube.client;

/**
 * Search builder for {@code api/audit_logs/search}. This endpoint pages with
 * {@code page}/{@code pageSize}.
 */
public final class AuditLogSearchBuilder
		extends PaginatedBuilder<AuditLogSearchBuilder, AuditLogsClient.AuditLogSearchResponse, AuditLogEntry> {

	AuditLogSearchBuilder(PageExecutor<AuditLogsClient.AuditLogSearchResponse> executor) {
		super(executor, PaginationStyle.MODERN);
	}

	public AuditLogSearchBuilder withCategory(String category) {
		return setParam("category", category);
	}

	public AuditLogSearchBuilder withAction(String action) {
		return setParam("action", action);
	}

	public AuditLogSearchBuilder byUser(String userLogin) {
		return setParam("userLogin", userLogin);
	}

	/**
	 * Lower bound of the event time.
	 * @param from ISO-8601 date or datetime
	 * @return this builder
	 */
	public AuditLogSearchBuilder from(String from) {
		return setParam("from", from);
	}

	/**
	 * Upper bound of the event time.
	 * @param to ISO-8601 date or datetime
	 * @return this builder
	 */
	public AuditLogSearchBuilder to(String to) {
		return setParam("to", to);
	}

}
