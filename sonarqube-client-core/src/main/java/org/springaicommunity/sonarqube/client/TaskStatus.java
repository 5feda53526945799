package org.springaicommunity.sonarqube.client;

/**
 * Status of a Compute Engine task.
 */
public enum TaskStatus {

	PENDING, IN_PROGRESS, SUCCESS, FAILED, CANCELED

}
