package org.springaicommunity.sonarqube.client;

/**
 * Search builder for {@code api/metrics/search}.
 */
public final class MetricSearchBuilder
		extends PaginatedBuilder<MetricSearchBuilder, MetricsClient.MetricSearchResponse, Metric> {

	MetricSearchBuilder(PageExecutor<MetricsClient.MetricSearchResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	public MetricSearchBuilder onlyCustom(boolean custom) {
		return setParam("isCustom", custom);
	}

}
