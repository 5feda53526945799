package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Client for {@code api/sources}.
 */
public class SourcesClient extends ResourceClient {

	public SourcesClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	/**
	 * Source code of a file as plain text.
	 * @param fileKey file key
	 * @param branch branch, or null
	 * @param pullRequest pull request, or null
	 * @return the source code
	 * @throws ValidationException if both a branch and a pull request are given
	 */
	public String raw(String fileKey, @Nullable String branch, @Nullable String pullRequest) {
		Validation.requireAtMostOne("branch", branch, "pullRequest", pullRequest);
		QueryParameters query = QueryParameters.create()
			.set("key", Validation.requireNonBlank(fileKey, "key"))
			.set("branch", branch)
			.set("pullRequest", pullRequest);
		return getText("/api/sources/raw", query);
	}

	public String raw(String fileKey) {
		return raw(fileKey, null, null);
	}

	/**
	 * Source lines of a file, optionally restricted to a range.
	 * @param fileKey file key
	 * @param from first line, 1-based, or null
	 * @param to last line, inclusive, or null
	 * @return the lines
	 */
	public List<SourceLine> show(String fileKey, @Nullable Integer from, @Nullable Integer to) {
		QueryParameters query = QueryParameters.create()
			.set("key", Validation.requireNonBlank(fileKey, "key"))
			.set("from", from)
			.set("to", to);
		return tuples(getTree("/api/sources/show", query).path("sources"), node -> new SourceLine(
				node.path(0).asInt(), node.path(1).asText("")));
	}

	/**
	 * SCM blame of a file.
	 * @param fileKey file key
	 * @param commitsByLine when false, consecutive lines of the same commit are grouped
	 * @return one entry per line or per group of lines
	 */
	public List<ScmLine> scm(String fileKey, boolean commitsByLine) {
		QueryParameters query = QueryParameters.create()
			.set("key", Validation.requireNonBlank(fileKey, "key"))
			.set("commits_by_line", commitsByLine);
		return tuples(getTree("/api/sources/scm", query).path("scm"), node -> new ScmLine(node.path(0).asInt(),
				node.path(1).asText(null), node.path(2).asText(null), node.path(3).asText(null)));
	}

	// These endpoints encode each line as a JSON array rather than an object
	private static <T> List<T> tuples(JsonNode array, Function<JsonNode, T> mapper) {
		List<T> result = new ArrayList<>();
		for (JsonNode node : array) {
			result.add(mapper.apply(node));
		}
		return List.copyOf(result);
	}

	/**
	 * @param line 1-based line number
	 * @param code line content, HTML highlighted
	 */
	public record SourceLine(int line, String code) {
	}

	/**
	 * @param line first line of the group
	 * @param author SCM author
	 * @param date commit date
	 * @param revision commit revision
	 */
	public record ScmLine(int line, @Nullable String author, @Nullable String date, @Nullable String revision) {
	}

}
