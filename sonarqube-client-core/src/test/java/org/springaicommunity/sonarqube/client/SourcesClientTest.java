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

@DisplayName("SourcesClient Tests")
@ExtendWith(MockitoExtension.class)
class SourcesClientTest {

	@Mock
	private SonarQubeTransport transport;

	private SourcesClient client;

	@BeforeEach
	void setUp() {
		client = new SourcesClient(transport, ObjectMapperFactory.create());
	}

	@Test
	@DisplayName("Should return raw source as text")
	void shouldReturnRawText() {
		when(transport.get(eq("/api/sources/raw"), any())).thenReturn("public class Main {\n}\n");

		String source = client.raw("my-app:src/Main.java", "develop", null);

		assertThat(source).isEqualTo("public class Main {\n}\n");
		verify(transport).get("/api/sources/raw",
				QueryParameters.create().set("key", "my-app:src/Main.java").set("branch", "develop"));
	}

	@Test
	@DisplayName("Should reject a branch combined with a pull request")
	void shouldRejectBranchAndPullRequest() {
		assertThatThrownBy(() -> client.raw("my-app:src/Main.java", "develop", "42"))
			.isInstanceOf(ValidationException.class);
		verifyNoInteractions(transport);
	}

	@Test
	@DisplayName("Should map source lines sent as arrays")
	void shouldMapSourceLines() {
		when(transport.get(eq("/api/sources/show"), any())).thenReturn("""
				{"sources": [[10, "<span class=\\"k\\">public</span> class Main {"], [11, "}"]]}
				""");

		List<SourcesClient.SourceLine> lines = client.show("my-app:src/Main.java", 10, 11);

		verify(transport).get("/api/sources/show",
				QueryParameters.create().set("key", "my-app:src/Main.java").set("from", 10).set("to", 11));
		assertThat(lines).containsExactly(
				new SourcesClient.SourceLine(10, "<span class=\"k\">public</span> class Main {"),
				new SourcesClient.SourceLine(11, "}"));
	}

	@Test
	@DisplayName("Should map blame entries sent as arrays")
	void shouldMapScm() {
		when(transport.get(eq("/api/sources/scm"), any())).thenReturn("""
				{"scm": [[1, "jdoe@example.com", "2024-02-10T09:00:00+0000", "a1b2c3"],
				         [4, "asmith@example.com", "2024-03-01T12:00:00+0000", "d4e5f6"]]}
				""");

		List<SourcesClient.ScmLine> scm = client.scm("my-app:src/Main.java", false);

		assertThat(scm).hasSize(2);
		assertThat(scm.get(1)).isEqualTo(
				new SourcesClient.ScmLine(4, "asmith@example.com", "2024-03-01T12:00:00+0000", "d4e5f6"));
	}

	@Test
	@DisplayName("Should return no lines when the field is missing")
	void shouldHandleMissingField() {
		when(transport.get(eq("/api/sources/scm"), any())).thenReturn("{}");

		assertThat(client.scm("my-app:src/Main.java", true)).isEmpty();
	}

}
