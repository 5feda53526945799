package org.springaicommunity.sonarqube.client;

/**
 * Issue statuses of the current model, accepted by the {@code issueStatuses} parameter.
 */
public enum IssueStatus {

	OPEN, CONFIRMED, FALSE_POSITIVE, ACCEPTED, FIXED

}
