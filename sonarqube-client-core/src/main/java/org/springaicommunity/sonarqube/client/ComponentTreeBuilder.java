package org.springaicommunity.sonarqube.client;

import java.util.Collection;
import java.util.List;

/**
 * Builder for {@code api/components/tree}, walking the descendants of a base component.
 */
public final class ComponentTreeBuilder
		extends PaginatedBuilder<ComponentTreeBuilder, ComponentsClient.ComponentTreeResponse, Component> {

	static final int MIN_QUERY_LENGTH = 3;

	ComponentTreeBuilder(PageExecutor<ComponentsClient.ComponentTreeResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	public ComponentTreeBuilder component(String componentKey) {
		return setParam("component", componentKey);
	}

	public ComponentTreeBuilder onBranch(String branch) {
		Validation.requireAtMostOne("pullRequest", getParam("pullRequest"), "branch", branch);
		return setParam("branch", branch);
	}

	public ComponentTreeBuilder onPullRequest(String pullRequest) {
		Validation.requireAtMostOne("branch", getParam("branch"), "pullRequest", pullRequest);
		return setParam("pullRequest", pullRequest);
	}

	/**
	 * Match on key or name.
	 * @param query at least three characters
	 * @return this builder
	 * @throws ValidationException if the query is shorter than three characters
	 */
	public ComponentTreeBuilder withQuery(String query) {
		Validation.requireMinLength(query, MIN_QUERY_LENGTH, "q");
		return setParam("q", query);
	}

	public ComponentTreeBuilder withQualifiers(Collection<ComponentQualifier> qualifiers) {
		return setParam("qualifiers", qualifiers);
	}

	public ComponentTreeBuilder withStrategy(ComponentTreeStrategy strategy) {
		return setParam("strategy", strategy);
	}

	public ComponentTreeBuilder filesOnly() {
		return withQualifiers(List.of(ComponentQualifier.FILE));
	}

	public ComponentTreeBuilder directoriesOnly() {
		return withQualifiers(List.of(ComponentQualifier.DIRECTORY));
	}

	public ComponentTreeBuilder childrenOnly() {
		return withStrategy(ComponentTreeStrategy.CHILDREN);
	}

	public ComponentTreeBuilder leavesOnly() {
		return withStrategy(ComponentTreeStrategy.LEAVES);
	}

	/**
	 * Sort the result.
	 * @param fields any of {@code name}, {@code path} and {@code qualifier}
	 * @param ascending sort direction
	 * @return this builder
	 */
	public ComponentTreeBuilder sortBy(Collection<String> fields, boolean ascending) {
		setParam("s", fields);
		return setParam("asc", ascending);
	}

}
