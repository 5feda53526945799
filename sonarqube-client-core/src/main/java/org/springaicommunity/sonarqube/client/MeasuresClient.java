package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * Client for {@code api/measures}.
 */
public class MeasuresClient extends ResourceClient {

	static final int MAX_METRIC_KEYS = 15;

	public MeasuresClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	/**
	 * Measures of a single component.
	 * @param componentKey component key
	 * @param metricKeys metrics to return, at most 15
	 * @param branch branch, or null
	 * @param pullRequest pull request, or null
	 * @return the component with its measures
	 */
	public ComponentMeasuresResponse component(String componentKey, Collection<String> metricKeys,
			@Nullable String branch, @Nullable String pullRequest) {
		requireMetricKeys(metricKeys, "metricKeys");
		Validation.requireAtMostOne("branch", branch, "pullRequest", pullRequest);
		QueryParameters query = QueryParameters.create()
			.set("component", Validation.requireNonBlank(componentKey, "component"))
			.set("metricKeys", metricKeys)
			.set("branch", branch)
			.set("pullRequest", pullRequest);
		return getJson("/api/measures/component", query, ComponentMeasuresResponse.class);
	}

	public ComponentMeasuresResponse component(String componentKey, Collection<String> metricKeys) {
		return component(componentKey, metricKeys, null, null);
	}

	/**
	 * Measures of the descendants of a component.
	 * @param componentKey base component
	 * @param metricKeys metrics to return, at most 15
	 * @return a builder for the traversal
	 */
	public ComponentTreeMeasuresBuilder componentTree(String componentKey, Collection<String> metricKeys) {
		requireMetricKeys(metricKeys, "metricKeys");
		return new ComponentTreeMeasuresBuilder(this::componentTree)
			.component(Validation.requireNonBlank(componentKey, "component"))
			.metricKeys(metricKeys);
	}

	public ComponentTreeMeasuresResponse componentTree(QueryParameters params) {
		return getJson("/api/measures/component_tree", params, ComponentTreeMeasuresResponse.class);
	}

	/**
	 * History of metrics over past analyses.
	 * @param componentKey component key
	 * @param metrics metrics to return
	 * @return a builder for the history
	 */
	public MeasuresHistoryBuilder searchHistory(String componentKey, Collection<String> metrics) {
		requireMetricKeys(metrics, "metrics");
		return new MeasuresHistoryBuilder(this::searchHistory)
			.component(Validation.requireNonBlank(componentKey, "component"))
			.metrics(metrics);
	}

	public MeasuresHistoryResponse searchHistory(QueryParameters params) {
		return getJson("/api/measures/search_history", params, MeasuresHistoryResponse.class);
	}

	private static void requireMetricKeys(Collection<String> metricKeys, String field) {
		Validation.requireNonEmpty(metricKeys, field);
		if (metricKeys.size() > MAX_METRIC_KEYS) {
			throw new ValidationException("At most " + MAX_METRIC_KEYS + " " + field + " are allowed", field);
		}
	}

	/**
	 * @param component the component with its measures
	 * @param metrics metric definitions, when requested
	 */
	public record ComponentMeasuresResponse(ComponentMeasures component, List<Metric> metrics) {

		public ComponentMeasuresResponse {
			metrics = metrics != null ? List.copyOf(metrics) : List.of();
		}

	}

	public record ComponentTreeMeasuresResponse(@Nullable ComponentMeasures baseComponent,
			List<ComponentMeasures> components, List<Metric> metrics, @Nullable Paging paging)
			implements Paged<ComponentMeasures> {

		public ComponentTreeMeasuresResponse {
			components = components != null ? List.copyOf(components) : List.of();
			metrics = metrics != null ? List.copyOf(metrics) : List.of();
		}

		@Override
		public List<ComponentMeasures> items() {
			return components;
		}

	}

	public record MeasuresHistoryResponse(List<MeasureHistory> measures, @Nullable Paging paging)
			implements Paged<MeasureHistory> {

		public MeasuresHistoryResponse {
			measures = measures != null ? List.copyOf(measures) : List.of();
		}

		@Override
		public List<MeasureHistory> items() {
			return measures;
		}

	}

}
