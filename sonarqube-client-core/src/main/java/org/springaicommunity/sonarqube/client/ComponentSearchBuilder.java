package org.springaicommunity.sonarqube.client;

import java.util.Collection;

/**
 * Search builder for {@code api/components/search}.
 */
public final class ComponentSearchBuilder
		extends PaginatedBuilder<ComponentSearchBuilder, ComponentsClient.ComponentSearchResponse, Component> {

	ComponentSearchBuilder(PageExecutor<ComponentsClient.ComponentSearchResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	/**
	 * Match on key or name.
	 * @param query substring of a key or name
	 * @return this builder
	 */
	public ComponentSearchBuilder withQuery(String query) {
		return setParam("q", query);
	}

	public ComponentSearchBuilder withQualifiers(Collection<ComponentQualifier> qualifiers) {
		return setParam("qualifiers", qualifiers);
	}

	public ComponentSearchBuilder inOrganization(String organization) {
		return setParam("organization", organization);
	}

}
