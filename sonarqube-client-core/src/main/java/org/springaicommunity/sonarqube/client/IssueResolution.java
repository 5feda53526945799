package org.springaicommunity.sonarqube.client;

public enum IssueResolution implements WireValue {

	FALSE_POSITIVE("FALSE-POSITIVE"), WONTFIX("WONTFIX"), FIXED("FIXED"), REMOVED("REMOVED");

	private final String wireValue;

	IssueResolution(String wireValue) {
		this.wireValue = wireValue;
	}

	@Override
	public String wireValue() {
		return wireValue;
	}

}
