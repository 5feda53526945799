package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/components}.
 */
public class ComponentsClient extends ResourceClient {

	public ComponentsClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public ComponentSearchBuilder search() {
		return new ComponentSearchBuilder(this::search);
	}

	public ComponentSearchResponse search(QueryParameters params) {
		return getJson("/api/components/search", params, ComponentSearchResponse.class);
	}

	/**
	 * Walk the descendants of a component.
	 * @param componentKey base component
	 * @return a builder for the traversal
	 */
	public ComponentTreeBuilder tree(String componentKey) {
		return new ComponentTreeBuilder(this::tree).component(Validation.requireNonBlank(componentKey, "component"));
	}

	public ComponentTreeResponse tree(QueryParameters params) {
		return getJson("/api/components/tree", params, ComponentTreeResponse.class);
	}

	/**
	 * Describe a component and its ancestors.
	 * @param componentKey component key
	 * @param branch branch, or null
	 * @param pullRequest pull request, or null
	 * @return the component
	 * @throws ValidationException if both a branch and a pull request are given
	 */
	public ComponentShowResponse show(String componentKey, @Nullable String branch, @Nullable String pullRequest) {
		Validation.requireAtMostOne("branch", branch, "pullRequest", pullRequest);
		QueryParameters query = QueryParameters.create()
			.set("component", Validation.requireNonBlank(componentKey, "component"))
			.set("branch", branch)
			.set("pullRequest", pullRequest);
		return getJson("/api/components/show", query, ComponentShowResponse.class);
	}

	public record ComponentSearchResponse(List<Component> components, @Nullable Paging paging)
			implements Paged<Component> {

		public ComponentSearchResponse {
			components = components != null ? List.copyOf(components) : List.of();
		}

		@Override
		public List<Component> items() {
			return components;
		}

	}

	/**
	 * Page of {@code api/components/tree}.
	 *
	 * @param baseComponent the component the traversal started from
	 * @param components descendants on this page
	 * @param paging paging information
	 */
	public record ComponentTreeResponse(@Nullable Component baseComponent, List<Component> components,
			@Nullable Paging paging) implements Paged<Component> {

		public ComponentTreeResponse {
			components = components != null ? List.copyOf(components) : List.of();
		}

		@Override
		public List<Component> items() {
			return components;
		}

	}

	/**
	 * @param component the component
	 * @param ancestors ancestors, nearest first
	 */
	public record ComponentShowResponse(Component component, List<Component> ancestors) {

		public ComponentShowResponse {
			ancestors = ancestors != null ? List.copyOf(ancestors) : List.of();
		}

	}

}
