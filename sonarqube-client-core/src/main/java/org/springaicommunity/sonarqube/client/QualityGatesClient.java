package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/qualitygates}. Gates are addressed by name.
 */
public class QualityGatesClient extends ResourceClient {

	public QualityGatesClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public QualityGateList list() {
		return getJson("/api/qualitygates/list", QueryParameters.create(), QualityGateList.class);
	}

	public QualityGate show(String gateName) {
		return getJson("/api/qualitygates/show", byName(gateName), QualityGate.class);
	}

	public QualityGate create(String gateName) {
		return postJson("/api/qualitygates/create", byName(gateName), QualityGate.class);
	}

	public void destroy(String gateName) {
		post("/api/qualitygates/destroy", byName(gateName));
	}

	/**
	 * Add a condition to a gate.
	 * @param gateName gate name
	 * @param metric metric key
	 * @param operator comparison operator
	 * @param error threshold that fails the gate
	 * @return the created condition
	 */
	public QualityGate.Condition createCondition(String gateName, String metric, QualityGateOperator operator,
			String error) {
		QueryParameters form = QueryParameters.create()
			.set("gateName", Validation.requireNonBlank(gateName, "gateName"))
			.set("metric", Validation.requireNonBlank(metric, "metric"))
			.set("op", operator)
			.set("error", Validation.requireNonBlank(error, "error"));
		return postJson("/api/qualitygates/create_condition", form, QualityGate.Condition.class);
	}

	public void deleteCondition(String conditionId) {
		post("/api/qualitygates/delete_condition",
				QueryParameters.create().set("id", Validation.requireNonBlank(conditionId, "id")));
	}

	/**
	 * Associate a project with a gate.
	 * @param gateName gate name
	 * @param projectKey project key
	 */
	public void select(String gateName, String projectKey) {
		QueryParameters form = QueryParameters.create()
			.set("gateName", Validation.requireNonBlank(gateName, "gateName"))
			.set("projectKey", Validation.requireNonBlank(projectKey, "projectKey"));
		post("/api/qualitygates/select", form);
	}

	/**
	 * Remove the explicit association of a project, which falls back to the default gate.
	 * @param projectKey project key
	 */
	public void deselect(String projectKey) {
		post("/api/qualitygates/deselect",
				QueryParameters.create().set("projectKey", Validation.requireNonBlank(projectKey, "projectKey")));
	}

	/**
	 * Quality gate status of a project.
	 * @param projectKey project key
	 * @param branch branch, or null
	 * @param pullRequest pull request, or null
	 * @return the status
	 * @throws ValidationException if both a branch and a pull request are given
	 */
	public ProjectStatus projectStatus(String projectKey, @Nullable String branch, @Nullable String pullRequest) {
		Validation.requireAtMostOne("branch", branch, "pullRequest", pullRequest);
		QueryParameters query = QueryParameters.create()
			.set("projectKey", Validation.requireNonBlank(projectKey, "projectKey"))
			.set("branch", branch)
			.set("pullRequest", pullRequest);
		return getJson("/api/qualitygates/project_status", query, ProjectStatusResponse.class).projectStatus();
	}

	/**
	 * Quality gate status computed by one analysis.
	 * @param analysisId analysis id, as found in a Compute Engine task
	 * @return the status
	 */
	public ProjectStatus analysisStatus(String analysisId) {
		QueryParameters query = QueryParameters.create()
			.set("analysisId", Validation.requireNonBlank(analysisId, "analysisId"));
		return getJson("/api/qualitygates/project_status", query, ProjectStatusResponse.class).projectStatus();
	}

	public QualityGateProjectsBuilder searchProjects(String gateName) {
		return new QualityGateProjectsBuilder(this::searchProjects)
			.gateName(Validation.requireNonBlank(gateName, "gateName"));
	}

	public QualityGateProjectsResponse searchProjects(QueryParameters params) {
		return getJson("/api/qualitygates/search", params, QualityGateProjectsResponse.class);
	}

	private static QueryParameters byName(String gateName) {
		return QueryParameters.create().set("name", Validation.requireNonBlank(gateName, "name"));
	}

	/**
	 * @param qualitygates every gate
	 * @param defaultGate name or id of the default gate on older servers
	 */
	public record QualityGateList(List<QualityGate> qualitygates,
			@JsonProperty("default") @Nullable String defaultGate) {

		public QualityGateList {
			qualitygates = qualitygates != null ? List.copyOf(qualitygates) : List.of();
		}

	}

	public record QualityGateProject(String key, @Nullable String name, @Nullable Boolean selected) {
	}

	public record QualityGateProjectsResponse(List<QualityGateProject> results, @Nullable Paging paging)
			implements Paged<QualityGateProject> {

		public QualityGateProjectsResponse {
			results = results != null ? List.copyOf(results) : List.of();
		}

		@Override
		public List<QualityGateProject> items() {
			return results;
		}

	}

	record ProjectStatusResponse(ProjectStatus projectStatus) {
	}

}
