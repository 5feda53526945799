package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/rules}.
 */
public class RulesClient extends ResourceClient {

	public RulesClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public RuleSearchBuilder search() {
		return new RuleSearchBuilder(this::search);
	}

	public RuleSearchResponse search(QueryParameters params) {
		return getJson("/api/rules/search", params, RuleSearchResponse.class);
	}

	public Rule show(String ruleKey) {
		QueryParameters query = QueryParameters.create().set("key", Validation.requireNonBlank(ruleKey, "key"));
		return getJson("/api/rules/show", query, ShowRuleResponse.class).rule();
	}

	/**
	 * List rule tags.
	 * @param query substring filter, or null
	 * @param pageSize maximum number of tags, server default when null
	 * @return matching tags
	 */
	public List<String> tags(@Nullable String query, @Nullable Integer pageSize) {
		QueryParameters params = QueryParameters.create().set("q", query).set("ps", pageSize);
		return getJson("/api/rules/tags", params, TagsResponse.class).tags();
	}

	/**
	 * Page of {@code api/rules/search}. Older servers report paging only through the
	 * top-level {@code p}, {@code ps} and {@code total} fields.
	 */
	public record RuleSearchResponse(List<Rule> rules, @Nullable Paging paging, @Nullable Integer p,
			@Nullable Integer ps, @Nullable Integer total) implements Paged<Rule> {

		public RuleSearchResponse {
			rules = rules != null ? List.copyOf(rules) : List.of();
			paging = Paging.resolve(paging, p, ps, total);
		}

		@Override
		public List<Rule> items() {
			return rules;
		}

	}

	record ShowRuleResponse(Rule rule) {
	}

	record TagsResponse(List<String> tags) {

		TagsResponse {
			tags = tags != null ? List.copyOf(tags) : List.of();
		}

	}

}
