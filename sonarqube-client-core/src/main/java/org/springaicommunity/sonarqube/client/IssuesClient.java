package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Client for {@code api/issues}.
 *
 * <p>
 * Write operations return the issue as updated by the server.
 */
public class IssuesClient extends ResourceClient {

	static final String SEARCH_PATH = "/api/issues/search";

	private final DeprecationRegistry deprecations;

	public IssuesClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		this(transport, objectMapper, new DeprecationRegistry(DeprecationPolicy.WARN));
	}

	public IssuesClient(SonarQubeTransport transport, ObjectMapper objectMapper, DeprecationRegistry deprecations) {
		super(transport, objectMapper);
		this.deprecations = Objects.requireNonNull(deprecations, "deprecations");
	}

	/**
	 * Start an issue search.
	 * @return a builder for the search
	 */
	public IssueSearchBuilder search() {
		return new IssueSearchBuilder(this::search, deprecations);
	}

	/**
	 * Fetch one page of {@code api/issues/search}.
	 * @param params query parameters, paging included
	 * @return the page
	 */
	public IssueSearchResponse search(QueryParameters params) {
		return getJson(SEARCH_PATH, params, IssueSearchResponse.class);
	}

	public Issue addComment(String issueKey, String text) {
		QueryParameters form = QueryParameters.create()
			.set("issue", Validation.requireNonBlank(issueKey, "issue"))
			.set("text", Validation.requireNonBlank(text, "text"));
		return postJson("/api/issues/add_comment", form, IssueResponse.class).issue();
	}

	/**
	 * Assign an issue, or unassign it.
	 * @param issueKey issue key
	 * @param assignee login of the new assignee, null to unassign
	 * @return the updated issue
	 */
	public Issue assign(String issueKey, @Nullable String assignee) {
		QueryParameters form = QueryParameters.create()
			.set("issue", Validation.requireNonBlank(issueKey, "issue"))
			.set("assignee", assignee);
		return postJson("/api/issues/assign", form, IssueResponse.class).issue();
	}

	public Issue doTransition(String issueKey, IssueTransition transition) {
		QueryParameters form = QueryParameters.create()
			.set("issue", Validation.requireNonBlank(issueKey, "issue"))
			.set("transition", transition);
		return postJson("/api/issues/do_transition", form, IssueResponse.class).issue();
	}

	/**
	 * Replace the tags of an issue. An empty collection removes all tags.
	 * @param issueKey issue key
	 * @param tags new tags
	 * @return the updated issue
	 */
	public Issue setTags(String issueKey, Collection<String> tags) {
		QueryParameters form = QueryParameters.create()
			.set("issue", Validation.requireNonBlank(issueKey, "issue"))
			.set("tags", String.join(",", tags));
		return postJson("/api/issues/set_tags", form, IssueResponse.class).issue();
	}

	/**
	 * List issue tags.
	 * @param query substring filter, or null
	 * @param pageSize maximum number of tags, server default when null
	 * @return matching tags
	 */
	public List<String> tags(@Nullable String query, @Nullable Integer pageSize) {
		QueryParameters params = QueryParameters.create().set("q", query).set("ps", pageSize);
		return getJson("/api/issues/tags", params, TagsResponse.class).tags();
	}

	public List<ChangelogEntry> changelog(String issueKey) {
		QueryParameters query = QueryParameters.create().set("issue", Validation.requireNonBlank(issueKey, "issue"));
		return getJson("/api/issues/changelog", query, ChangelogResponse.class).changelog();
	}

	/**
	 * Page of {@code api/issues/search}.
	 *
	 * @param issues the issues of this page
	 * @param paging paging information
	 * @param total total number of issues, also reported in {@code paging}
	 * @param effortTotal total remediation effort in minutes
	 */
	public record IssueSearchResponse(List<Issue> issues, @Nullable Paging paging, @Nullable Integer total,
			@Nullable Long effortTotal) implements Paged<Issue> {

		public IssueSearchResponse {
			issues = issues != null ? List.copyOf(issues) : List.of();
		}

		@Override
		public List<Issue> items() {
			return issues;
		}

	}

	record IssueResponse(Issue issue) {
	}

	record TagsResponse(List<String> tags) {

		TagsResponse {
			tags = tags != null ? List.copyOf(tags) : List.of();
		}

	}

	record ChangelogResponse(List<ChangelogEntry> changelog) {

		ChangelogResponse {
			changelog = changelog != null ? List.copyOf(changelog) : List.of();
		}

	}

}
