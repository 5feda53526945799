package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

/**
 * Metric definition as returned by {@code api/metrics/search}.
 *
 * @param key metric key, e.g. {@code ncloc}
 * @param name display name
 * @param type value type, e.g. {@code INT} or {@code PERCENT}
 * @param description description
 * @param domain domain, e.g. {@code Size}
 * @param direction -1 when lower is better, 1 when higher is better, 0 when neither
 * @param qualitative whether the metric expresses quality
 * @param hidden whether the metric is hidden from the UI
 */
public record Metric(String key, @Nullable String name, @Nullable String type, @Nullable String description,
		@Nullable String domain, @Nullable Integer direction, @Nullable Boolean qualitative, @Nullable Boolean hidden) {
}
