package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A coding rule as returned by {@code api/rules/search} and {@code api/rules/show}. Which
 * fields are present depends on the {@code f} parameter of the search.
 *
 * @param key rule key, e.g. {@code java:S1068}
 * @param repo repository key
 * @param name rule name
 * @param htmlDesc HTML description, superseded by description sections on recent servers
 * @param mdDesc Markdown description
 * @param severity legacy severity
 * @param status {@code READY}, {@code BETA}, {@code DEPRECATED} or {@code REMOVED}
 * @param type legacy type
 * @param lang language key
 * @param langName language name
 * @param template whether this is a template rule
 * @param templateKey key of the template a custom rule was created from
 * @param createdAt creation date
 * @param tags user tags
 * @param sysTags built-in tags
 * @param cleanCodeAttribute clean code attribute
 * @param impacts software quality impacts
 * @param params rule parameters
 */
public record Rule(String key, @Nullable String repo, @Nullable String name, @Nullable String htmlDesc,
		@Nullable String mdDesc, @Nullable String severity, @Nullable String status, @Nullable String type,
		@Nullable String lang, @Nullable String langName, @JsonProperty("isTemplate") @Nullable Boolean template,
		@Nullable String templateKey, @Nullable String createdAt, List<String> tags, List<String> sysTags,
		@Nullable String cleanCodeAttribute, List<Impact> impacts, List<Param> params) {

	public Rule {
		tags = tags != null ? List.copyOf(tags) : List.of();
		sysTags = sysTags != null ? List.copyOf(sysTags) : List.of();
		impacts = impacts != null ? List.copyOf(impacts) : List.of();
		params = params != null ? List.copyOf(params) : List.of();
	}

	/**
	 * A rule parameter.
	 */
	public record Param(String key, @Nullable String htmlDesc, @Nullable String defaultValue, @Nullable String type) {
	}

}
