package org.springaicommunity.sonarqube.client;

/**
 * Names of the pagination parameters an endpoint expects.
 *
 * <p>
 * The Web API is not uniform here, so every builder declares the style of the endpoint it
 * targets.
 */
public enum PaginationStyle {

	/**
	 * {@code p} and {@code ps}, used by most {@code api/*} endpoints.
	 */
	LEGACY("p", "ps"),

	/**
	 * {@code page} and {@code pageSize}, used by newer endpoints such as audit logs.
	 */
	MODERN("page", "pageSize");

	private final String pageParam;

	private final String pageSizeParam;

	PaginationStyle(String pageParam, String pageSizeParam) {
		this.pageParam = pageParam;
		this.pageSizeParam = pageSizeParam;
	}

	public String pageParam() {
		return pageParam;
	}

	public String pageSizeParam() {
		return pageSizeParam;
	}

}
