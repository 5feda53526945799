package org.springaicommunity.sonarqube.client;

/**
 * Implemented by enums whose query-string spelling differs from their constant name.
 */
public interface WireValue {

	/**
	 * Returns the value as the Web API expects it.
	 * @return wire representation
	 */
	String wireValue();

}
