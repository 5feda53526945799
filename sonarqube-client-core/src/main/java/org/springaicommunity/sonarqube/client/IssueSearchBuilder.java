package org.springaicommunity.sonarqube.client;

import java.util.Collection;
import java.util.List;

/**
 * Search builder for {@code api/issues/search}.
 *
 * <p>
 * The legacy {@code statuses}, {@code severities}, {@code types} and {@code resolutions}
 * filters are still sent and reported to the client's {@link DeprecationRegistry}. Prefer
 * {@link #withIssueStatuses(Collection)}, {@link #withImpactSeverities(Collection)} and
 * {@link #withImpactSoftwareQualities(Collection)}.
 */
public final class IssueSearchBuilder
		extends PaginatedBuilder<IssueSearchBuilder, IssuesClient.IssueSearchResponse, Issue> {

	private final DeprecationRegistry deprecations;

	IssueSearchBuilder(PageExecutor<IssuesClient.IssueSearchResponse> executor, DeprecationRegistry deprecations) {
		super(executor, PaginationStyle.LEGACY);
		this.deprecations = deprecations;
	}

	public IssueSearchBuilder withProjects(Collection<String> projectKeys) {
		return setParam("projects", projectKeys);
	}

	public IssueSearchBuilder withComponents(Collection<String> componentKeys) {
		return setParam("componentKeys", componentKeys);
	}

	public IssueSearchBuilder withIssues(Collection<String> issueKeys) {
		return setParam("issues", issueKeys);
	}

	public IssueSearchBuilder withRules(Collection<String> ruleKeys) {
		return setParam("rules", ruleKeys);
	}

	public IssueSearchBuilder withTags(Collection<String> tags) {
		return setParam("tags", tags);
	}

	public IssueSearchBuilder withLanguages(Collection<String> languages) {
		return setParam("languages", languages);
	}

	public IssueSearchBuilder withIssueStatuses(Collection<IssueStatus> statuses) {
		return setParam("issueStatuses", statuses);
	}

	public IssueSearchBuilder withImpactSeverities(Collection<ImpactSeverity> severities) {
		return setParam("impactSeverities", severities);
	}

	public IssueSearchBuilder withImpactSoftwareQualities(Collection<SoftwareQuality> qualities) {
		return setParam("impactSoftwareQualities", qualities);
	}

	public IssueSearchBuilder withCleanCodeAttributeCategories(Collection<CleanCodeAttributeCategory> categories) {
		return setParam("cleanCodeAttributeCategories", categories);
	}

	/**
	 * Filter on legacy statuses.
	 * @param statuses statuses
	 * @return this builder
	 * @deprecated since SonarQube 10.4, use {@link #withIssueStatuses(Collection)}
	 */
	@Deprecated
	public IssueSearchBuilder withStatuses(Collection<LegacyIssueStatus> statuses) {
		warnDeprecated("statuses", "withIssueStatuses()");
		return setParam("statuses", statuses);
	}

	/**
	 * Filter on legacy severities.
	 * @param severities severities
	 * @return this builder
	 * @deprecated since SonarQube 10.2, use {@link #withImpactSeverities(Collection)}
	 */
	@Deprecated
	public IssueSearchBuilder withSeverities(Collection<IssueSeverity> severities) {
		warnDeprecated("severities", "withImpactSeverities()");
		return setParam("severities", severities);
	}

	/**
	 * Filter on legacy types.
	 * @param types types
	 * @return this builder
	 * @deprecated since SonarQube 10.2, use {@link #withImpactSoftwareQualities(Collection)}
	 */
	@Deprecated
	public IssueSearchBuilder withTypes(Collection<IssueType> types) {
		warnDeprecated("types", "withImpactSoftwareQualities()");
		return setParam("types", types);
	}

	/**
	 * Filter on resolutions.
	 * @param resolutions resolutions
	 * @return this builder
	 * @deprecated since SonarQube 10.4, use {@link #withIssueStatuses(Collection)}
	 */
	@Deprecated
	public IssueSearchBuilder withResolutions(Collection<IssueResolution> resolutions) {
		warnDeprecated("resolutions", "withIssueStatuses()");
		return setParam("resolutions", resolutions);
	}

	public IssueSearchBuilder assignedTo(String assignee) {
		return setParam("assignees", List.of(assignee));
	}

	public IssueSearchBuilder assignedToAny(Collection<String> assignees) {
		return setParam("assignees", assignees);
	}

	public IssueSearchBuilder byAuthors(Collection<String> authors) {
		return setParam("author", authors);
	}

	public IssueSearchBuilder createdAfter(String date) {
		return setParam("createdAfter", date);
	}

	public IssueSearchBuilder createdBefore(String date) {
		return setParam("createdBefore", date);
	}

	/**
	 * Only issues created during the given period, e.g. {@code 1m2w} for one month and two
	 * weeks.
	 * @param period period expression
	 * @return this builder
	 */
	public IssueSearchBuilder createdInLast(String period) {
		return setParam("createdInLast", period);
	}

	/**
	 * Restrict to a branch. Cannot be combined with {@link #onPullRequest(String)}.
	 * @param branch branch name
	 * @return this builder
	 */
	public IssueSearchBuilder onBranch(String branch) {
		Validation.requireAtMostOne("pullRequest", getParam("pullRequest"), "branch", branch);
		return setParam("branch", branch);
	}

	public IssueSearchBuilder onPullRequest(String pullRequest) {
		Validation.requireAtMostOne("branch", getParam("branch"), "pullRequest", pullRequest);
		return setParam("pullRequest", pullRequest);
	}

	public IssueSearchBuilder onlyResolved() {
		return setParam("resolved", true);
	}

	public IssueSearchBuilder onlyUnresolved() {
		return setParam("resolved", false);
	}

	public IssueSearchBuilder onlyAssigned() {
		return setParam("assigned", true);
	}

	public IssueSearchBuilder onlyUnassigned() {
		return setParam("assigned", false);
	}

	public IssueSearchBuilder inNewCodePeriod() {
		return setParam("inNewCodePeriod", true);
	}

	public IssueSearchBuilder inOrganization(String organization) {
		return setParam("organization", organization);
	}

	public IssueSearchBuilder sortBy(String field, boolean ascending) {
		setParam("s", field);
		return setParam("asc", ascending);
	}

	/**
	 * Request extra fields, e.g. {@code comments} or {@code rules}.
	 * @param fields additional field names, or {@code _all}
	 * @return this builder
	 */
	public IssueSearchBuilder withAdditionalFields(Collection<String> fields) {
		return setParam("additionalFields", fields);
	}

	public IssueSearchBuilder withFacets(Collection<String> facets) {
		return setParam("facets", facets);
	}

	private void warnDeprecated(String parameter, String replacement) {
		deprecations.report("api/issues/search#" + parameter, replacement, parameter);
	}

}
