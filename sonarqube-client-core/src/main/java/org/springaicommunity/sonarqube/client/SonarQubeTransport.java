package org.springaicommunity.sonarqube.client;

/**
 * Interface for sending requests to the SonarQube Web API. Abstracts the HTTP layer so
 * that resource clients can be tested with mocks and decorated, for example with
 * {@link RetryingSonarQubeTransport}.
 *
 * <p>
 * Implementations throw a {@link SonarQubeException} produced by {@link ErrorClassifier}
 * for every non-2xx response and every transport failure.
 */
public interface SonarQubeTransport {

	/**
	 * Execute a GET request.
	 * @param path API path, e.g. {@code /api/issues/search}
	 * @param query query parameters, possibly empty
	 * @return the response body as text
	 */
	String get(String path, QueryParameters query);

	/**
	 * Execute a GET request for a binary resource.
	 * @param path API path
	 * @param query query parameters, possibly empty
	 * @return the raw response body
	 */
	byte[] getBytes(String path, QueryParameters query);

	/**
	 * Execute a form-encoded POST request, the convention of SonarQube write endpoints.
	 * @param path API path
	 * @param form form parameters
	 * @return the response body, empty for endpoints that return 204
	 */
	String post(String path, QueryParameters form);

}
