package org.springaicommunity.sonarqube.client;

public enum CleanCodeAttributeCategory {

	ADAPTABLE, CONSISTENT, INTENTIONAL, RESPONSIBLE

}
