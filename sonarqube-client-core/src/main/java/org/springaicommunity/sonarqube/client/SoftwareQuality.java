package org.springaicommunity.sonarqube.client;

public enum SoftwareQuality {

	MAINTAINABILITY, RELIABILITY, SECURITY

}
