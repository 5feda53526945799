package org.springaicommunity.sonarqube.client;

/**
 * Legacy issue severities, superseded by {@link ImpactSeverity}.
 */
public enum IssueSeverity {

	INFO, MINOR, MAJOR, CRITICAL, BLOCKER

}
