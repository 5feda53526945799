package org.springaicommunity.sonarqube.client;

public enum ImpactSeverity {

	INFO, LOW, MEDIUM, HIGH, BLOCKER

}
