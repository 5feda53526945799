package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/metrics}.
 */
public class MetricsClient extends ResourceClient {

	public MetricsClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public MetricSearchBuilder search() {
		return new MetricSearchBuilder(this::search);
	}

	/**
	 * Older servers report paging only through top-level {@code p}, {@code ps} and
	 * {@code total}.
	 */
	public MetricSearchResponse search(QueryParameters params) {
		return getJson("/api/metrics/search", params, MetricSearchResponse.class);
	}

	/**
	 * Value types a metric can have, such as {@code INT} or {@code RATING}.
	 * @return the types
	 */
	public List<String> types() {
		return getJson("/api/metrics/types", QueryParameters.create(), TypesResponse.class).types();
	}

	public record MetricSearchResponse(List<Metric> metrics, @Nullable Paging paging, @Nullable Integer p,
			@Nullable Integer ps, @Nullable Integer total) implements Paged<Metric> {

		public MetricSearchResponse {
			metrics = metrics != null ? List.copyOf(metrics) : List.of();
			paging = Paging.resolve(paging, p, ps, total);
		}

		@Override
		public List<Metric> items() {
			return metrics;
		}

	}

	record TypesResponse(List<String> types) {

		TypesResponse {
			types = types != null ? List.copyOf(types) : List.of();
		}

	}

}
