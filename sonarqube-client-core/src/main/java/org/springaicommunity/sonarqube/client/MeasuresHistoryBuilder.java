package org.springaicommunity.sonarqube.client;

import java.util.Collection;

/**
 * Builder for {@code api/measures/search_history}. Pages walk through analyses, so each
 * page carries a slice of the history of every requested metric.
 */
public final class MeasuresHistoryBuilder
		extends PaginatedBuilder<MeasuresHistoryBuilder, MeasuresClient.MeasuresHistoryResponse, MeasureHistory> {

	MeasuresHistoryBuilder(PageExecutor<MeasuresClient.MeasuresHistoryResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	MeasuresHistoryBuilder component(String componentKey) {
		return setParam("component", componentKey);
	}

	MeasuresHistoryBuilder metrics(Collection<String> metricKeys) {
		return setParam("metrics", metricKeys);
	}

	public MeasuresHistoryBuilder onBranch(String branch) {
		Validation.requireAtMostOne("pullRequest", getParam("pullRequest"), "branch", branch);
		return setParam("branch", branch);
	}

	public MeasuresHistoryBuilder onPullRequest(String pullRequest) {
		Validation.requireAtMostOne("branch", getParam("branch"), "pullRequest", pullRequest);
		return setParam("pullRequest", pullRequest);
	}

	/**
	 * @param date first analysis date, {@code yyyy-MM-dd} or a datetime
	 * @return this builder
	 */
	public MeasuresHistoryBuilder from(String date) {
		return setParam("from", date);
	}

	public MeasuresHistoryBuilder to(String date) {
		return setParam("to", date);
	}

}
