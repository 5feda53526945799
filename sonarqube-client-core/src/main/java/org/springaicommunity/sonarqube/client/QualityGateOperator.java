package org.springaicommunity.sonarqube.client;

public enum QualityGateOperator {

	/** Fails when the value is lower than the threshold. */
	LT,
	/** Fails when the value is greater than the threshold. */
	GT

}
