package org.springaicommunity.sonarqube.client;

/**
 * Builder for {@code api/qualitygates/search}, listing the projects associated with a
 * gate.
 */
public final class QualityGateProjectsBuilder extends PaginatedBuilder<QualityGateProjectsBuilder,
		QualityGatesClient.QualityGateProjectsResponse, QualityGatesClient.QualityGateProject> {

	QualityGateProjectsBuilder(PageExecutor<QualityGatesClient.QualityGateProjectsResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	QualityGateProjectsBuilder gateName(String gateName) {
		return setParam("gateName", gateName);
	}

	public QualityGateProjectsBuilder withQuery(String query) {
		return setParam("query", query);
	}

	/**
	 * By default only associated projects are listed.
	 * @param selected {@code selected}, {@code deselected} or {@code all}
	 * @return this builder
	 */
	public QualityGateProjectsBuilder withSelection(String selected) {
		return setParam("selected", selected);
	}

	public QualityGateProjectsBuilder onlyDeselected() {
		return withSelection("deselected");
	}

	public QualityGateProjectsBuilder showAll() {
		return withSelection("all");
	}

}
