package org.springaicommunity.sonarqube.client;

public enum ProjectVisibility implements WireValue {

	PUBLIC("public"), PRIVATE("private");

	private final String wireValue;

	ProjectVisibility(String wireValue) {
		this.wireValue = wireValue;
	}

	@Override
	public String wireValue() {
		return wireValue;
	}

}
