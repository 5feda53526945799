package org.springaicommunity.sonarqube.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Client for {@code api/ce}, the Compute Engine that processes analysis reports.
 */
public class CeClient extends ResourceClient {

	public CeClient(SonarQubeTransport transport, ObjectMapper objectMapper) {
		super(transport, objectMapper);
	}

	public ActivityBuilder activity() {
		return new ActivityBuilder(this::activity);
	}

	public ActivityResponse activity(QueryParameters params) {
		return getJson("/api/ce/activity", params, ActivityResponse.class);
	}

	/**
	 * Fetch a single task.
	 * @param taskId task id
	 * @param additionalFields extra fields such as {@code warnings} or {@code stacktrace}
	 * @return the task
	 */
	public CeTask task(String taskId, List<String> additionalFields) {
		QueryParameters query = QueryParameters.create()
			.set("id", Validation.requireNonBlank(taskId, "id"))
			.set("additionalFields", additionalFields);
		return getJson("/api/ce/task", query, TaskResponse.class).task();
	}

	public CeTask task(String taskId) {
		return task(taskId, List.of());
	}

	/**
	 * Pending, running and last finished tasks of a component.
	 * @param componentKey component key
	 * @return the tasks
	 */
	public ComponentTasks component(String componentKey) {
		QueryParameters query = QueryParameters.create()
			.set("component", Validation.requireNonBlank(componentKey, "component"));
		return getJson("/api/ce/component", query, ComponentTasks.class);
	}

	/**
	 * Page of {@code api/ce/activity}. Recent servers return paging, older ones do not, in
	 * which case iteration stops after the first page.
	 */
	public record ActivityResponse(List<CeTask> tasks, @Nullable Paging paging) implements Paged<CeTask> {

		public ActivityResponse {
			tasks = tasks != null ? List.copyOf(tasks) : List.of();
		}

		@Override
		public List<CeTask> items() {
			return tasks;
		}

	}

	/**
	 * @param queue pending tasks
	 * @param current the task currently running, if any
	 * @param lastExecutedTask the most recent finished task, if any
	 */
	public record ComponentTasks(List<CeTask> queue, @Nullable CeTask current, @Nullable CeTask lastExecutedTask) {

		public ComponentTasks {
			queue = queue != null ? List.copyOf(queue) : List.of();
		}

	}

	record TaskResponse(CeTask task) {
	}

}
