package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/projects}: search, provisioning, deletion and settings of
 * projects.
 */
public class ProjectsClient extends ResourceClient {

	static final String SEARCH_PATH = "/api/projects/search";

	public ProjectsClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	/**
	 * Start a project search. Requires the 'Administer System' permission.
	 * @return a builder for the search
	 */
	public ProjectSearchBuilder search() {
		return new ProjectSearchBuilder(this::search);
	}

	/**
	 * Fetch one page of {@code api/projects/search}.
	 * @param params query parameters, paging included
	 * @return the page
	 */
	public ProjectSearchResponse search(QueryParameters params) {
		return getJson(SEARCH_PATH, params, ProjectSearchResponse.class);
	}

	public Project create(String projectKey, String name) {
		return create(projectKey, name, null, null);
	}

	/**
	 * Provision a project.
	 * @param projectKey key of the new project
	 * @param name display name
	 * @param visibility visibility, server default when null
	 * @param mainBranch name of the main branch, server default when null
	 * @return the created project
	 */
	public Project create(String projectKey, String name, @Nullable ProjectVisibility visibility,
			@Nullable String mainBranch) {
		QueryParameters form = QueryParameters.create()
			.set("project", Validation.requireNonBlank(projectKey, "project"))
			.set("name", Validation.requireNonBlank(name, "name"))
			.set("visibility", visibility)
			.set("mainBranch", mainBranch);
		return postJson("/api/projects/create", form, CreateProjectResponse.class).project();
	}

	public void delete(String projectKey) {
		post("/api/projects/delete",
				QueryParameters.create().set("project", Validation.requireNonBlank(projectKey, "project")));
	}

	/**
	 * Change the key of a project. Branches and pull requests follow.
	 * @param from current key
	 * @param to new key
	 */
	public void updateKey(String from, String to) {
		post("/api/projects/update_key", QueryParameters.create()
			.set("from", Validation.requireNonBlank(from, "from"))
			.set("to", Validation.requireNonBlank(to, "to")));
	}

	public void updateVisibility(String projectKey, ProjectVisibility visibility) {
		post("/api/projects/update_visibility", QueryParameters.create()
			.set("project", Validation.requireNonBlank(projectKey, "project"))
			.set("visibility", visibility));
	}

	/**
	 * Export every issue and hotspot of a branch or pull request.
	 * @param projectKey project key
	 * @param branch branch name, or null
	 * @param pullRequest pull request id, or null
	 * @return the findings
	 * @throws ValidationException if both a branch and a pull request are given
	 */
	public List<Finding> exportFindings(String projectKey, @Nullable String branch, @Nullable String pullRequest) {
		Validation.requireAtMostOne("branch", branch, "pullRequest", pullRequest);
		QueryParameters query = QueryParameters.create()
			.set("project", Validation.requireNonBlank(projectKey, "project"))
			.set("branch", branch)
			.set("pullRequest", pullRequest);
		return getJson("/api/projects/export_findings", query, new TypeReference<List<Finding>>() {
		});
	}

	/**
	 * Page of {@code api/projects/search}.
	 *
	 * @param components the projects of this page
	 * @param paging paging information
	 */
	public record ProjectSearchResponse(List<Project> components, @Nullable Paging paging) implements Paged<Project> {

		public ProjectSearchResponse {
			components = components != null ? List.copyOf(components) : List.of();
		}

		@Override
		public List<Project> items() {
			return components;
		}

	}

	record CreateProjectResponse(Project project) {
	}

}
