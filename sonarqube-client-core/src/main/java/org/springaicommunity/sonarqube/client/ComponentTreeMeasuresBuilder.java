package org.springaicommunity.sonarqube.client;

import java.util.Collection;

/**
 * Builder for {@code api/measures/component_tree}.
 */
public final class ComponentTreeMeasuresBuilder extends PaginatedBuilder<ComponentTreeMeasuresBuilder,
		MeasuresClient.ComponentTreeMeasuresResponse, ComponentMeasures> {

	ComponentTreeMeasuresBuilder(PageExecutor<MeasuresClient.ComponentTreeMeasuresResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	ComponentTreeMeasuresBuilder component(String componentKey) {
		return setParam("component", componentKey);
	}

	ComponentTreeMeasuresBuilder metricKeys(Collection<String> metricKeys) {
		return setParam("metricKeys", metricKeys);
	}

	public ComponentTreeMeasuresBuilder withStrategy(ComponentTreeStrategy strategy) {
		return setParam("strategy", strategy);
	}

	public ComponentTreeMeasuresBuilder withQualifiers(Collection<ComponentQualifier> qualifiers) {
		return setParam("qualifiers", qualifiers);
	}

	public ComponentTreeMeasuresBuilder onBranch(String branch) {
		Validation.requireAtMostOne("pullRequest", getParam("pullRequest"), "branch", branch);
		return setParam("branch", branch);
	}

	public ComponentTreeMeasuresBuilder onPullRequest(String pullRequest) {
		Validation.requireAtMostOne("branch", getParam("branch"), "pullRequest", pullRequest);
		return setParam("pullRequest", pullRequest);
	}

	/**
	 * Request {@code metrics} and/or {@code periods} alongside the measures.
	 * @param fields additional field names
	 * @return this builder
	 */
	public ComponentTreeMeasuresBuilder withAdditionalFields(Collection<String> fields) {
		return setParam("additionalFields", fields);
	}

	public ComponentTreeMeasuresBuilder withQuery(String query) {
		Validation.requireMinLength(query, ComponentTreeBuilder.MIN_QUERY_LENGTH, "q");
		return setParam("q", query);
	}

	/**
	 * Sort components on the value of a metric.
	 * @param metricKey metric to sort on, must be one of the requested metric keys
	 * @param withMeasuresOnly drop components without a value for the metric
	 * @param ascending sort direction
	 * @return this builder
	 */
	public ComponentTreeMeasuresBuilder sortByMetric(String metricKey, boolean withMeasuresOnly, boolean ascending) {
		setParam("s", "metric");
		setParam("metricSort", metricKey);
		setParam("metricSortFilter", withMeasuresOnly ? "withMeasuresOnly" : "all");
		return setParam("asc", ascending);
	}

}
