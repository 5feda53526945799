package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A component with the measures that were requested for it.
 */
public record ComponentMeasures(String key, @Nullable String name, @Nullable String qualifier, @Nullable String path,
		@Nullable String language, List<Measure> measures) {

	public ComponentMeasures {
		measures = measures != null ? List.copyOf(measures) : List.of();
	}

	/**
	 * Look up the measure of a metric.
	 * @param metricKey metric key
	 * @return the measure, or null if the component has none for that metric
	 */
	@Nullable
	public Measure measure(String metricKey) {
		for (Measure measure : measures) {
			if (measure.metric().equals(metricKey)) {
				return measure;
			}
		}
		return null;
	}

}
