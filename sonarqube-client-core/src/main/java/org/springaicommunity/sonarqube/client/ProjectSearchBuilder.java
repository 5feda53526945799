package org.springaicommunity.sonarqube.client;

import java.util.Collection;

/**
 * Search builder for {@code api/projects/search}.
 */
public final class ProjectSearchBuilder
		extends PaginatedBuilder<ProjectSearchBuilder, ProjectsClient.ProjectSearchResponse, Project> {

	ProjectSearchBuilder(PageExecutor<ProjectsClient.ProjectSearchResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	public ProjectSearchBuilder withQuery(String query) {
		return setParam("q", query);
	}

	public ProjectSearchBuilder withProjects(Collection<String> projectKeys) {
		return setParam("projects", projectKeys);
	}

	public ProjectSearchBuilder withQualifiers(Collection<ComponentQualifier> qualifiers) {
		return setParam("qualifiers", qualifiers);
	}

	/**
	 * Only projects whose last analysis is older than the given date.
	 * @param date date or datetime in ISO format
	 * @return this builder
	 */
	public ProjectSearchBuilder analyzedBefore(String date) {
		return setParam("analyzedBefore", date);
	}

	public ProjectSearchBuilder onlyProvisioned() {
		return setParam("onProvisionedOnly", true);
	}

	public ProjectSearchBuilder inOrganization(String organization) {
		return setParam("organization", organization);
	}

}
