package org.springaicommunity.sonarqube.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("CeClient Tests")
@ExtendWith(MockitoExtension.class)
class CeClientTest {

	@Mock
	private SonarQubeTransport transport;

	private CeClient client;

	@BeforeEach
	void setUp() {
		client = new CeClient(transport, ObjectMapperFactory.create());
	}

	@Nested
	@DisplayName("Activity")
	class ActivityTest {

		@Test
		@DisplayName("Should reject componentId after a query without calling the server")
		void shouldRejectComponentIdAfterQuery() {
			ActivityBuilder builder = client.activity().withQuery("my-app");

			assertThatThrownBy(() -> builder.withComponentId("AU-Tpxb--iU5OvuD2FLy"))
				.isInstanceOf(ValidationException.class)
				.hasMessageContaining("componentId");
			verifyNoInteractions(transport);
		}

		@Test
		@DisplayName("Should reject a query after componentId without calling the server")
		void shouldRejectQueryAfterComponentId() {
			ActivityBuilder builder = client.activity().withComponentId("AU-Tpxb--iU5OvuD2FLy");

			assertThatThrownBy(() -> builder.withQuery("my-app")).isInstanceOf(ValidationException.class);
			assertThat(builder.getParams().contains("q")).isFalse();
			verifyNoInteractions(transport);
		}

		@Test
		@DisplayName("Should send statuses as a comma separated list")
		void shouldSendStatuses() {
			when(transport.get(eq("/api/ce/activity"), any())).thenReturn("{\"tasks\":[]}");

			client.activity()
				.withComponent("my-app")
				.withStatuses(TaskStatus.FAILED, TaskStatus.CANCELED)
				.onlyCurrents()
				.execute();

			verify(transport).get("/api/ce/activity", QueryParameters.create()
				.set("component", "my-app")
				.set("status", List.of(TaskStatus.FAILED, TaskStatus.CANCELED))
				.set("onlyCurrents", true));
		}

		@Test
		@DisplayName("Should stop after one page when the server reports no paging")
		void shouldStopWithoutPaging() {
			when(transport.get(eq("/api/ce/activity"), any())).thenReturn("""
					{"tasks": [
					    {"id": "T1", "type": "REPORT", "componentKey": "my-app", "status": "SUCCESS",
					     "analysisId": "A1", "executionTimeMs": 1520},
					    {"id": "T2", "type": "REPORT", "componentKey": "my-app", "status": "FAILED",
					     "errorMessage": "Analysis report is corrupted"}
					]}
					""");

			List<CeTask> tasks = client.activity().withComponent("my-app").stream().toList();

			assertThat(tasks).extracting(CeTask::id).containsExactly("T1", "T2");
			assertThat(tasks.get(0).executionTimeMs()).isEqualTo(1520L);
			assertThat(tasks.get(1).isFinished()).isTrue();
			verify(transport, times(1)).get(eq("/api/ce/activity"), any());
		}

	}

	@Test
	@DisplayName("Should read a single task")
	void shouldReadTask() {
		when(transport.get(eq("/api/ce/task"), any())).thenReturn("""
				{"task": {"id": "T1", "status": "IN_PROGRESS", "componentKey": "my-app",
				          "warnings": ["Missing blame information"], "warningCount": 1}}
				""");

		CeTask task = client.task("T1", List.of("warnings"));

		verify(transport).get("/api/ce/task", QueryParameters.create().set("id", "T1").set("additionalFields",
				List.of("warnings")));
		assertThat(task.isFinished()).isFalse();
		assertThat(task.warnings()).containsExactly("Missing blame information");
	}

	@Test
	@DisplayName("Should read the queue of a component")
	void shouldReadComponentTasks() {
		when(transport.get(eq("/api/ce/component"), any())).thenReturn("""
				{"queue": [{"id": "T3", "status": "PENDING"}],
				 "current": {"id": "T2", "status": "SUCCESS", "analysisId": "A2"}}
				""");

		CeClient.ComponentTasks tasks = client.component("my-app");

		assertThat(tasks.queue()).extracting(CeTask::status).containsExactly("PENDING");
		assertThat(tasks.current().analysisId()).isEqualTo("A2");
		assertThat(tasks.lastExecutedTask()).isNull();
	}

}
