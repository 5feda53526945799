package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Values of one metric over past analyses, oldest first.
 */
public record MeasureHistory(String metric, List<Point> history) {

	public MeasureHistory {
		history = history != null ? List.copyOf(history) : List.of();
	}

	/**
	 * Value at one analysis. The value is absent when the metric was not computed.
	 */
	public record Point(String date, @Nullable String value) {
	}

}
