package org.springaicommunity.sonarqube.client;

/**
 * Outcome of a reviewed hotspot.
 */
public enum HotspotResolution {

	FIXED, SAFE, ACKNOWLEDGED

}
