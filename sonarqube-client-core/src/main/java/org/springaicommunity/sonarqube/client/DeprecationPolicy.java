package org.springaicommunity.sonarqube.client;

/**
 * How the client reacts when a deprecated parameter or operation is used.
 */
public enum DeprecationPolicy {

	/** Log a warning the first time each deprecated usage is seen. */
	WARN,
	/** Record the usage without logging. */
	SILENT,
	/** Reject the usage with a {@link ValidationException} before any request is sent. */
	STRICT

}
