package org.springaicommunity.sonarqube.client;

/**
 * Issue statuses of the model replaced in SonarQube 10.4, accepted by the deprecated
 * {@code statuses} parameter.
 */
public enum LegacyIssueStatus {

	OPEN, CONFIRMED, REOPENED, RESOLVED, CLOSED

}
