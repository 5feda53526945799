package org.springaicommunity.sonarqube.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingSonarQubeTransport}.
 *
 * Tests retry logic, exponential backoff, and which failures are considered transient.
 */
@DisplayName("RetryingSonarQubeTransport Tests")
@ExtendWith(MockitoExtension.class)
class RetryingSonarQubeTransportTest {

	private static final QueryParameters QUERY = QueryParameters.create().set("projects", "my-app");

	@Mock
	private SonarQubeTransport mockDelegate;

	private RetryingSonarQubeTransport retryingTransport;

	@BeforeEach
	void setUp() {
		// Use minimal delay for fast tests
		retryingTransport = RetryingSonarQubeTransport.builder()
			.wrapping(mockDelegate)
			.maxRetries(3)
			.initialDelayMs(1)
			.build();
	}

	private static ServerException serverError() {
		return new ServerException("Internal error", 500, "req-1", null, Map.of());
	}

	@Nested
	@DisplayName("Delegation Tests")
	class DelegationTest {

		@Test
		@DisplayName("Should delegate get() to wrapped transport")
		void shouldDelegateGet() {
			when(mockDelegate.get("/api/issues/search", QUERY)).thenReturn("{\"issues\":[]}");

			String result = retryingTransport.get("/api/issues/search", QUERY);

			assertThat(result).isEqualTo("{\"issues\":[]}");
			verify(mockDelegate, times(1)).get("/api/issues/search", QUERY);
		}

		@Test
		@DisplayName("Should delegate getBytes() to wrapped transport")
		void shouldDelegateGetBytes() {
			byte[] content = { 1, 2, 3 };
			when(mockDelegate.getBytes("/api/audit_logs/download", QUERY)).thenReturn(content);

			assertThat(retryingTransport.getBytes("/api/audit_logs/download", QUERY)).isSameAs(content);
		}

		@Test
		@DisplayName("Should delegate post() to wrapped transport")
		void shouldDelegatePost() {
			when(mockDelegate.post("/api/favorites/add", QUERY)).thenReturn("");

			retryingTransport.post("/api/favorites/add", QUERY);

			verify(mockDelegate).post("/api/favorites/add", QUERY);
		}

	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should retry on server error (5xx)")
		void shouldRetryOnServerError() {
			when(mockDelegate.get("/path", QUERY)).thenThrow(serverError())
				.thenThrow(serverError())
				.thenReturn("success");

			String result = retryingTransport.get("/path", QUERY);

			assertThat(result).isEqualTo("success");
			verify(mockDelegate, times(3)).get("/path", QUERY);
		}

		@Test
		@DisplayName("Should retry on rate limit error (429)")
		void shouldRetryOnRateLimitError() {
			RateLimitException rateLimited = new RateLimitException("Too many requests", 0, null, Map.of());
			when(mockDelegate.get("/path", QUERY)).thenThrow(rateLimited).thenReturn("success");

			String result = retryingTransport.get("/path", QUERY);

			assertThat(result).isEqualTo("success");
			verify(mockDelegate, times(2)).get("/path", QUERY);
		}

		@Test
		@DisplayName("Should retry on network and timeout failures")
		void shouldRetryOnTransportFailures() {
			when(mockDelegate.get("/path", QUERY))
				.thenThrow(new NetworkException("Network error: reset", new IOException("reset")))
				.thenThrow(new RequestTimeoutException("Request timed out", new IOException("timeout")))
				.thenReturn("success");

			assertThat(retryingTransport.get("/path", QUERY)).isEqualTo("success");
			verify(mockDelegate, times(3)).get("/path", QUERY);
		}

		@Test
		@DisplayName("Should NOT retry on client errors (4xx except 429)")
		void shouldNotRetryOnClientErrors() {
			List<SonarQubeException> clientErrors = List.of(new ValidationException("bad", List.of(), null, Map.of()),
					new AuthenticationException("Unauthorized", null, Map.of()),
					new AuthorizationException("Forbidden", null, Map.of()),
					new NotFoundException("Not Found", null, Map.of()));

			for (SonarQubeException error : clientErrors) {
				reset(mockDelegate);
				when(mockDelegate.get("/path", QUERY)).thenThrow(error);

				assertThatThrownBy(() -> retryingTransport.get("/path", QUERY)).isSameAs(error);
				verify(mockDelegate, times(1)).get("/path", QUERY);
			}
		}

		@Test
		@DisplayName("Should NOT retry POST requests")
		void shouldNotRetryPost() {
			when(mockDelegate.post("/api/issues/do_transition", QUERY)).thenThrow(serverError());

			assertThatThrownBy(() -> retryingTransport.post("/api/issues/do_transition", QUERY))
				.isInstanceOf(ServerException.class);

			verify(mockDelegate, times(1)).post("/api/issues/do_transition", QUERY);
		}

		@Test
		@DisplayName("Should NOT retry indexing errors unless enabled")
		void shouldNotRetryIndexingByDefault() {
			IndexingInProgressException indexing = new IndexingInProgressException("indexing in progress", null, null,
					Map.of());
			when(mockDelegate.get("/path", QUERY)).thenThrow(indexing);

			assertThatThrownBy(() -> retryingTransport.get("/path", QUERY)).isSameAs(indexing);
			verify(mockDelegate, times(1)).get("/path", QUERY);
		}

		@Test
		@DisplayName("Should retry indexing errors when enabled")
		void shouldRetryIndexingWhenEnabled() {
			RetryingSonarQubeTransport patient = RetryingSonarQubeTransport.builder()
				.wrapping(mockDelegate)
				.initialDelayMs(1)
				.retryIndexing(true)
				.build();
			when(mockDelegate.get("/path", QUERY))
				.thenThrow(new IndexingInProgressException("indexing in progress", null, null, Map.of()))
				.thenReturn("ready");

			assertThat(patient.get("/path", QUERY)).isEqualTo("ready");
		}

	}

	@Nested
	@DisplayName("Max Retries Tests")
	class MaxRetriesTest {

		@Test
		@DisplayName("Should stop after max retries and throw the last exception")
		void shouldStopAfterMaxRetries() {
			ServerException last = serverError();
			when(mockDelegate.get("/path", QUERY)).thenThrow(serverError(), serverError(), serverError())
				.thenThrow(last);

			assertThatThrownBy(() -> retryingTransport.get("/path", QUERY)).isSameAs(last);

			// Initial attempt + 3 retries = 4 total attempts
			verify(mockDelegate, times(4)).get("/path", QUERY);
		}

		@Test
		@DisplayName("Should succeed on last retry attempt")
		void shouldSucceedOnLastRetry() {
			when(mockDelegate.get("/path", QUERY)).thenThrow(serverError())
				.thenThrow(serverError())
				.thenThrow(serverError())
				.thenReturn("success");

			assertThat(retryingTransport.get("/path", QUERY)).isEqualTo("success");
			verify(mockDelegate, times(4)).get("/path", QUERY);
		}

		@Test
		@DisplayName("Should work with zero retries")
		void shouldWorkWithZeroRetries() {
			RetryingSonarQubeTransport noRetry = RetryingSonarQubeTransport.builder()
				.wrapping(mockDelegate)
				.maxRetries(0)
				.build();
			when(mockDelegate.get(eq("/path"), any())).thenThrow(serverError());

			assertThatThrownBy(() -> noRetry.get("/path", QUERY)).isInstanceOf(ServerException.class);
			verify(mockDelegate, times(1)).get("/path", QUERY);
		}

	}

	@Nested
	@DisplayName("Wait Time Tests")
	class WaitTimeTest {

		@Test
		@DisplayName("Should honour Retry-After within the cap")
		void shouldHonourRetryAfter() {
			RateLimitException rateLimited = new RateLimitException("slow down", 60, null, Map.of());

			assertThat(retryingTransport.computeWaitTime(rateLimited, 1)).isEqualTo(60_000);
		}

		@Test
		@DisplayName("Should fall back to backoff when Retry-After exceeds the cap")
		void shouldCapRetryAfter() {
			RetryingSonarQubeTransport capped = RetryingSonarQubeTransport.builder()
				.wrapping(mockDelegate)
				.maxRetryAfter(Duration.ofSeconds(10))
				.build();
			RateLimitException rateLimited = new RateLimitException("slow down", 3600, null, Map.of());

			assertThat(capped.computeWaitTime(rateLimited, 250)).isEqualTo(250);
		}

		@Test
		@DisplayName("Should use backoff when Retry-After is absent")
		void shouldUseBackoffWithoutRetryAfter() {
			RateLimitException rateLimited = new RateLimitException("slow down", null, null, Map.of());

			assertThat(retryingTransport.computeWaitTime(rateLimited, 8)).isEqualTo(8);
			assertThat(retryingTransport.computeWaitTime(serverError(), 16)).isEqualTo(16);
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should build with defaults")
		void shouldBuildWithDefaults() {
			RetryingSonarQubeTransport defaultTransport = RetryingSonarQubeTransport.builder()
				.wrapping(mockDelegate)
				.build();

			assertThat(defaultTransport.isRetryable(serverError())).isTrue();
			assertThat(defaultTransport.isRetryable(new NotFoundException("missing", null, Map.of()))).isFalse();
		}

		@Test
		@DisplayName("Should require a transport to wrap")
		void shouldRequireDelegate() {
			assertThatThrownBy(() -> RetryingSonarQubeTransport.builder().build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping()");
		}

		@Test
		@DisplayName("Should reject negative max retries")
		void shouldRejectNegativeMaxRetries() {
			assertThatThrownBy(() -> RetryingSonarQubeTransport.builder().wrapping(mockDelegate).maxRetries(-1).build())
				.isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should reject a non-positive initial delay")
		void shouldRejectNonPositiveDelay() {
			RetryingSonarQubeTransport.Builder builder = RetryingSonarQubeTransport.builder()
				.wrapping(mockDelegate)
				.initialDelay(Duration.ZERO);

			assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
		}

	}

}
