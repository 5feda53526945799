package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

/**
 * Paging block of a paginated Web API response.
 *
 * @param pageIndex 1-based index of the returned page
 * @param pageSize requested page size
 * @param total number of items across all pages of the query
 */
public record Paging(int pageIndex, int pageSize, int total) {

	/**
	 * Resolves the paging of a response that may use either the {@code paging} block or the
	 * older top-level {@code p}/{@code ps}/{@code total} fields.
	 * @param paging the {@code paging} block, if present
	 * @param p top-level page index, if present
	 * @param ps top-level page size, if present
	 * @param total top-level total, if present
	 * @return the paging, or null if the response carried none
	 */
	@Nullable
	public static Paging resolve(@Nullable Paging paging, @Nullable Integer p, @Nullable Integer ps,
			@Nullable Integer total) {
		if (paging != null) {
			return paging;
		}
		if (total == null) {
			return null;
		}
		return new Paging(p != null ? p : 1, ps != null ? ps : 0, total);
	}

}
