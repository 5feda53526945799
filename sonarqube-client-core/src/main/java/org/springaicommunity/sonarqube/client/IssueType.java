package org.springaicommunity.sonarqube.client;

public enum IssueType {

	CODE_SMELL, BUG, VULNERABILITY, SECURITY_HOTSPOT

}
