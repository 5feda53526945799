package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

/**
 * Value of one metric on one component.
 *
 * @param metric metric key
 * @param value value as formatted by the server, absent when only a period value exists
 * @param bestValue whether the value is the best possible one
 * @param period value on the new code period
 */
public record Measure(String metric, @Nullable String value, @Nullable Boolean bestValue,
		@Nullable PeriodValue period) {

	/**
	 * Value of a metric on the new code period.
	 */
	public record PeriodValue(@Nullable Integer index, @Nullable String value, @Nullable Boolean bestValue) {
	}

}
