package org.springaicommunity.sonarqube.client;

/**
 * Component qualifiers as used by the {@code qualifiers} request parameters.
 */
public enum ComponentQualifier implements WireValue {

	PROJECT("TRK"), APPLICATION("APP"), PORTFOLIO("VW"), SUB_PORTFOLIO("SVW"), DIRECTORY("DIR"), FILE("FIL"),
	UNIT_TEST_FILE("UTS");

	private final String wireValue;

	ComponentQualifier(String wireValue) {
		this.wireValue = wireValue;
	}

	@Override
	public String wireValue() {
		return wireValue;
	}

}
