package org.springaicommunity.sonarqube.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("QualityGatesClient Tests")
@ExtendWith(MockitoExtension.class)
class QualityGatesClientTest {

	@Mock
	private SonarQubeTransport transport;

	private QualityGatesClient client;

	@BeforeEach
	void setUp() {
		client = new QualityGatesClient(transport, ObjectMapperFactory.create());
	}

	@Test
	@DisplayName("Should list gates with their flags")
	void shouldListGates() {
		when(transport.get(eq("/api/qualitygates/list"), any())).thenReturn("""
				{"qualitygates": [
				    {"name": "Sonar way", "isDefault": true, "isBuiltIn": true,
				     "conditions": [{"id": "c1", "metric": "new_coverage", "op": "LT", "error": "80"}]},
				    {"name": "Strict", "isDefault": false, "isBuiltIn": false}
				], "default": "Sonar way"}
				""");

		QualityGatesClient.QualityGateList list = client.list();

		assertThat(list.defaultGate()).isEqualTo("Sonar way");
		QualityGate sonarWay = list.qualitygates().get(0);
		assertThat(sonarWay.defaultGate()).isTrue();
		assertThat(sonarWay.builtIn()).isTrue();
		assertThat(sonarWay.conditions()).containsExactly(new QualityGate.Condition("c1", "new_coverage", "LT", "80"));
		assertThat(list.qualitygates().get(1).conditions()).isEmpty();
	}

	@Test
	@DisplayName("Should read the project status")
	void shouldReadProjectStatus() {
		when(transport.get(eq("/api/qualitygates/project_status"), any())).thenReturn("""
				{"projectStatus": {"status": "ERROR", "ignoredConditions": false, "conditions": [
				    {"status": "ERROR", "metricKey": "new_coverage", "comparator": "LT",
				     "errorThreshold": "80", "actualValue": "42.5"}
				]}}
				""");

		ProjectStatus status = client.projectStatus("my-app", null, "42");

		verify(transport).get("/api/qualitygates/project_status",
				QueryParameters.create().set("projectKey", "my-app").set("pullRequest", "42"));
		assertThat(status.passed()).isFalse();
		assertThat(status.conditions()).singleElement()
			.satisfies(condition -> assertThat(condition.actualValue()).isEqualTo("42.5"));
	}

	@Test
	@DisplayName("Should select a gate by name")
	void shouldSelectGate() {
		client.select("Strict", "my-app");

		verify(transport).post("/api/qualitygates/select",
				QueryParameters.create().set("gateName", "Strict").set("projectKey", "my-app"));
	}

	@Test
	@DisplayName("Should create a condition with the operator name")
	void shouldCreateCondition() {
		when(transport.post(eq("/api/qualitygates/create_condition"), any()))
			.thenReturn("{\"id\":\"c9\",\"metric\":\"blocker_violations\",\"op\":\"GT\",\"error\":\"0\"}");

		QualityGate.Condition condition = client.createCondition("Strict", "blocker_violations",
				QualityGateOperator.GT, "0");

		assertThat(condition.id()).isEqualTo("c9");
		verify(transport).post(eq("/api/qualitygates/create_condition"),
				argThat(form -> "gateName=Strict&metric=blocker_violations&op=GT&error=0"
					.equals(form.toQueryString())));
	}

	@Test
	@DisplayName("Should page through the projects of a gate")
	void shouldSearchProjects() {
		when(transport.get(eq("/api/qualitygates/search"), any())).thenReturn("""
				{"paging": {"pageIndex": 1, "pageSize": 100, "total": 2},
				 "results": [{"key": "a", "name": "A", "selected": true}, {"key": "b", "name": "B", "selected": false}]}
				""");

		List<String> keys = client.searchProjects("Strict")
			.showAll()
			.stream()
			.map(QualityGatesClient.QualityGateProject::key)
			.toList();

		assertThat(keys).containsExactly("a", "b");
		verify(transport, times(1)).get(eq("/api/qualitygates/search"),
				argThat(query -> "Strict".equals(query.get("gateName")) && "all".equals(query.get("selected"))));
	}

}
