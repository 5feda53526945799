package org.springaicommunity.sonarqube.client;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Compute Engine task, typically the processing of an analysis report.
 *
 * @param id task id
 * @param type task type, for example {@code REPORT}
 * @param componentId id of the analysed component
 * @param componentKey key of the analysed component
 * @param componentName name of the analysed component
 * @param componentQualifier qualifier of the analysed component
 * @param analysisId analysis created by the task, once it succeeded
 * @param status task status, see {@link TaskStatus}
 * @param submittedAt submission time
 * @param submitterLogin login of the submitter
 * @param startedAt start time
 * @param executedAt end time
 * @param executionTimeMs execution time in milliseconds
 * @param warningCount number of warnings
 * @param warnings warning messages, only returned when requested
 * @param errorMessage failure message
 * @param errorType failure type
 * @param branch branch the task ran for
 * @param branchType branch type
 * @param pullRequest pull request the task ran for
 */
public record CeTask(String id, @Nullable String type, @Nullable String componentId, @Nullable String componentKey,
		@Nullable String componentName, @Nullable String componentQualifier, @Nullable String analysisId,
		String status, @Nullable String submittedAt, @Nullable String submitterLogin, @Nullable String startedAt,
		@Nullable String executedAt, @Nullable Long executionTimeMs, @Nullable Integer warningCount,
		List<String> warnings, @Nullable String errorMessage, @Nullable String errorType, @Nullable String branch,
		@Nullable String branchType, @Nullable String pullRequest) {

	public CeTask {
		warnings = warnings != null ? List.copyOf(warnings) : List.of();
	}

	public boolean isFinished() {
		return TaskStatus.SUCCESS.name().equals(status) || TaskStatus.FAILED.name().equals(status)
				|| TaskStatus.CANCELED.name().equals(status);
	}

}
