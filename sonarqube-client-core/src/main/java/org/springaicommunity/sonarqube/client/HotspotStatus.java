package org.springaicommunity.sonarqube.client;

public enum HotspotStatus {

	TO_REVIEW, REVIEWED

}
