package org.springaicommunity.sonarqube.client;

/**
 * How far below the base component a tree query descends.
 */
public enum ComponentTreeStrategy implements WireValue {

	/** Every descendant. */
	ALL("all"),
	/** Direct children only. */
	CHILDREN("children"),
	/** Descendants without children, such as files. */
	LEAVES("leaves");

	private final String wireValue;

	ComponentTreeStrategy(String wireValue) {
		this.wireValue = wireValue;
	}

	@Override
	public String wireValue() {
		return wireValue;
	}

}
