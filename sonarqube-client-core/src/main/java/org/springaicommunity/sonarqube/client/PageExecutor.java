package org.springaicommunity.sonarqube.client;

/**
 * Performs one page fetch for a set of query parameters.
 *
 * <p>
 * Supplied by a resource client to each builder it creates. Builders never build HTTP
 * requests themselves.
 *
 * @param <R> the response type
 */
@FunctionalInterface
public interface PageExecutor<R> {

	/**
	 * Fetch one response.
	 * @param params serialized-ready snapshot of the builder's parameters
	 * @return the response
	 * @throws SonarQubeException if the call fails
	 */
	R fetch(QueryParameters params);

}
