package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A quality gate with its conditions.
 *
 * @param id identifier, only reported by older servers
 * @param name unique name
 * @param defaultGate whether the gate applies to projects without an explicit gate
 * @param builtIn whether the gate is provided by SonarQube and read-only
 * @param conditions conditions, present on {@code show} only
 */
public record QualityGate(@Nullable String id, String name, @JsonProperty("isDefault") boolean defaultGate,
		@JsonProperty("isBuiltIn") boolean builtIn, List<Condition> conditions) {

	public QualityGate {
		conditions = conditions != null ? List.copyOf(conditions) : List.of();
	}

	/**
	 * A condition of a quality gate.
	 *
	 * @param id condition id
	 * @param metric metric key
	 * @param op {@code LT} or {@code GT}
	 * @param error threshold that fails the gate
	 */
	public record Condition(String id, String metric, @Nullable String op, @Nullable String error) {
	}

}
