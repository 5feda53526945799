package org.springaicommunity.sonarqube.client;

import java.util.Arrays;

/**
 * Search builder for {@code api/ce/activity}.
 *
 * <p>
 * {@link #withQuery(String)} and {@link #withComponentId(String)} cannot be combined. The
 * second of the two throws {@link ValidationException} immediately.
 */
public final class ActivityBuilder extends PaginatedBuilder<ActivityBuilder, CeClient.ActivityResponse, CeTask> {

	ActivityBuilder(PageExecutor<CeClient.ActivityResponse> executor) {
		super(executor, PaginationStyle.LEGACY);
	}

	public ActivityBuilder withComponent(String componentKey) {
		return setParam("component", componentKey);
	}

	public ActivityBuilder withComponentId(String componentId) {
		if (hasParam("q")) {
			throw new ValidationException("componentId cannot be set when a query is already set", "componentId");
		}
		return setParam("componentId", componentId);
	}

	/**
	 * Match on component key or name, or on task id.
	 * @param query search text
	 * @return this builder
	 * @throws ValidationException if a component id is already set
	 */
	public ActivityBuilder withQuery(String query) {
		if (hasParam("componentId")) {
			throw new ValidationException("query cannot be set when a componentId is already set", "q");
		}
		return setParam("q", query);
	}

	public ActivityBuilder withStatuses(TaskStatus... statuses) {
		return setParam("status", Arrays.asList(statuses));
	}

	public ActivityBuilder withType(String type) {
		return setParam("type", type);
	}

	public ActivityBuilder onlyCurrents() {
		return setParam("onlyCurrents", true);
	}

	public ActivityBuilder minSubmittedAt(String minSubmittedAt) {
		return setParam("minSubmittedAt", minSubmittedAt);
	}

	public ActivityBuilder maxExecutedAt(String maxExecutedAt) {
		return setParam("maxExecutedAt", maxExecutedAt);
	}

}
