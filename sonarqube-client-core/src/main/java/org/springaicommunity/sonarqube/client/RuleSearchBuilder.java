package org.springaicommunity.sonarqube.client;

import java.util.Collection;

/**
 * Search builder for {@code api/rules/search}.
 */
public final class RuleSearchBuilder extends PaginatedBuilder<RuleSearchBuilder, RulesClient.RuleSearchResponse, Rule> {

	RuleSearchBuilder(PageExecutor<RulesClient.RuleSearchResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	public RuleSearchBuilder withQuery(String query) {
		return setParam("q", query);
	}

	public RuleSearchBuilder withLanguages(Collection<String> languages) {
		return setParam("languages", languages);
	}

	public RuleSearchBuilder withRepositories(Collection<String> repositories) {
		return setParam("repositories", repositories);
	}

	public RuleSearchBuilder withRuleKey(String ruleKey) {
		return setParam("rule_key", ruleKey);
	}

	public RuleSearchBuilder withTags(Collection<String> tags) {
		return setParam("tags", tags);
	}

	public RuleSearchBuilder withImpactSeverities(Collection<ImpactSeverity> severities) {
		return setParam("impactSeverities", severities);
	}

	public RuleSearchBuilder withImpactSoftwareQualities(Collection<SoftwareQuality> qualities) {
		return setParam("impactSoftwareQualities", qualities);
	}

	public RuleSearchBuilder withCleanCodeAttributeCategories(Collection<CleanCodeAttributeCategory> categories) {
		return setParam("cleanCodeAttributeCategories", categories);
	}

	/**
	 * Restrict to rules of a quality profile, active or not depending on
	 * {@link #withActivation(boolean)}.
	 * @param profileKey quality profile key
	 * @return this builder
	 */
	public RuleSearchBuilder inQualityProfile(String profileKey) {
		return setParam("qprofile", profileKey);
	}

	public RuleSearchBuilder withActivation(boolean activated) {
		return setParam("activation", activated);
	}

	public RuleSearchBuilder templatesOnly(boolean template) {
		return setParam("is_template", template);
	}

	public RuleSearchBuilder includeExternal() {
		return setParam("include_external", true);
	}

	/**
	 * Restrict the returned fields, e.g. {@code name}, {@code lang} or {@code params}.
	 * @param fields field names
	 * @return this builder
	 */
	public RuleSearchBuilder withFields(Collection<String> fields) {
		return setParam("f", fields);
	}

	public RuleSearchBuilder inOrganization(String organization) {
		return setParam("organization", organization);
	}

}
