package org.springaicommunity.sonarqube.client;

/**
 * Workflow transitions accepted by {@code api/issues/do_transition}.
 */
public enum IssueTransition implements WireValue {

	CONFIRM("confirm"), UNCONFIRM("unconfirm"), REOPEN("reopen"), RESOLVE("resolve"),
	FALSE_POSITIVE("falsepositive"), WONT_FIX("wontfix"), ACCEPT("accept"), CLOSE("close");

	private final String wireValue;

	IssueTransition(String wireValue) {
		this.wireValue = wireValue;
	}

	@Override
	public String wireValue() {
		return wireValue;
	}

}
