package org.springaicommunity.sonarqube.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ErrorClassifier Tests")
class ErrorClassifierTest {

	private static final String SONAR_ERROR = "{\"errors\":[{\"msg\":\"Component key 'foo' not found\"}]}";

	private ErrorClassifier classifier;

	@BeforeEach
	void setUp() {
		classifier = new ErrorClassifier(ObjectMapperFactory.create());
	}

	@Nested
	@DisplayName("Status mapping")
	class StatusMappingTest {

		@ParameterizedTest(name = "{0} -> {1}")
		@CsvSource({ "400, VALIDATION", "401, AUTHENTICATION", "403, AUTHORIZATION", "404, NOT_FOUND",
				"410, REMOVED_API", "429, RATE_LIMIT", "500, SERVER", "502, SERVER", "503, SERVER", "599, SERVER",
				"418, API", "409, API", "302, API" })
		@DisplayName("Should map each status to exactly one kind")
		void shouldMapStatus(int status, ErrorKind kind) {
			SonarQubeException error = classifier.classify(status, SONAR_ERROR, Map.of());

			assertThat(error.getKind()).isEqualTo(kind);
			assertThat(error.getStatusCode()).isEqualTo(status);
			assertThat(error.getResponseBody()).isEqualTo(SONAR_ERROR);
		}

		@Test
		@DisplayName("Should produce the concrete exception types")
		void shouldProduceConcreteTypes() {
			assertThat(classifier.classify(400, null, Map.of())).isInstanceOf(ValidationException.class);
			assertThat(classifier.classify(401, null, Map.of())).isInstanceOf(AuthenticationException.class);
			assertThat(classifier.classify(403, null, Map.of())).isInstanceOf(AuthorizationException.class);
			assertThat(classifier.classify(404, null, Map.of())).isInstanceOf(NotFoundException.class);
			assertThat(classifier.classify(410, null, Map.of())).isInstanceOf(RemovedApiException.class);
			assertThat(classifier.classify(429, null, Map.of())).isInstanceOf(RateLimitException.class);
			assertThat(classifier.classify(500, null, Map.of())).isInstanceOf(ServerException.class);
			assertThat(classifier.classify(418, null, Map.of())).isExactlyInstanceOf(ApiException.class);
		}

	}

	@Nested
	@DisplayName("Message extraction")
	class MessageTest {

		@Test
		@DisplayName("Should use the first error message of a SonarQube error body")
		void shouldUseErrorMessage() {
			SonarQubeException error = classifier.classify(404, SONAR_ERROR, Map.of());

			assertThat(error).hasMessage("Component key 'foo' not found");
		}

		@Test
		@DisplayName("Should join several error messages")
		void shouldJoinMessages() {
			String body = "{\"errors\":[{\"msg\":\"first\"},{\"msg\":\"second\"}]}";

			assertThat(classifier.classify(400, body, Map.of())).hasMessage("first, second");
		}

		@ParameterizedTest
		@NullAndEmptySource
		@ValueSource(strings = { "   ", "{}", "{\"errors\":[]}", "{\"errors\":[{\"code\":1}]}", "[1,2]" })
		@DisplayName("Should fall back to the status for bodies without messages")
		void shouldFallBackToStatus(String body) {
			assertThat(classifier.classify(502, body, Map.of())).hasMessage("HTTP 502");
		}

		@Test
		@DisplayName("Should use plain text bodies as the message")
		void shouldUsePlainText() {
			assertThat(classifier.classify(502, "  Bad Gateway\n", Map.of())).hasMessage("Bad Gateway");
		}

		@Test
		@DisplayName("Should treat malformed JSON as text without failing")
		void shouldTolerateMalformedJson() {
			SonarQubeException error = classifier.classify(500, "{\"errors\":[", Map.of());

			assertThat(error).isInstanceOf(ServerException.class).hasMessage("{\"errors\":[");
		}

		@Test
		@DisplayName("Should truncate long text bodies")
		void shouldTruncateLongText() {
			String body = "x".repeat(2000);

			SonarQubeException error = classifier.classify(500, body, Map.of());

			assertThat(error.getMessage()).hasSize(ErrorClassifier.MAX_TEXT_MESSAGE_LENGTH);
			assertThat(error.getResponseBody()).hasSize(2000);
		}

	}

	@Nested
	@DisplayName("Validation errors")
	class ValidationTest {

		@Test
		@DisplayName("Should carry field errors from the body")
		void shouldCarryFieldErrors() {
			String body = "{\"errors\":[{\"msg\":\"Value too long\",\"field\":\"name\"},{\"msg\":\"Missing key\"}]}";

			ValidationException error = (ValidationException) classifier.classify(400, body, Map.of());

			assertThat(error.getErrors()).containsExactly(new ValidationException.FieldError("name", "Value too long"),
					new ValidationException.FieldError(null, "Missing key"));
		}

	}

	@Nested
	@DisplayName("Rate limiting")
	class RateLimitTest {

		@Test
		@DisplayName("Should read Retry-After in seconds")
		void shouldReadRetryAfter() {
			SonarQubeException error = classifier.classify(429, null, Map.of("Retry-After", List.of("60")));

			assertThat(error).isInstanceOf(RateLimitException.class);
			assertThat(((RateLimitException) error).getRetryAfterSeconds()).isEqualTo(60);
		}

		@Test
		@DisplayName("Should match the header name case-insensitively")
		void shouldIgnoreHeaderCase() {
			SonarQubeException error = classifier.classify(429, null, Map.of("retry-after", List.of("5")));

			assertThat(((RateLimitException) error).getRetryAfterSeconds()).isEqualTo(5);
			assertThat(error.getHeader("RETRY-AFTER")).isEqualTo("5");
		}

		@Test
		@DisplayName("Should leave Retry-After absent when the header is missing")
		void shouldHandleMissingHeader() {
			RateLimitException error = (RateLimitException) classifier.classify(429, null, Map.of());

			assertThat(error.getRetryAfterSeconds()).isNull();
		}

		@Test
		@DisplayName("Should tolerate a header without a value")
		void shouldTolerateNullHeaderValue() {
			Map<String, List<String>> headers = new LinkedHashMap<>();
			headers.put("Retry-After", null);
			headers.put("X-Frame-Options", List.of("SAMEORIGIN"));

			SonarQubeException error = classifier.classify(429, "x", headers);

			assertThat(((RateLimitException) error).getRetryAfterSeconds()).isNull();
			assertThat(error.getHeaders()).containsOnlyKeys("X-Frame-Options");
		}

		@ParameterizedTest
		@ValueSource(strings = { "soon", "-5", "1.5", "Wed, 21 Oct 2015 07:28:00 GMT" })
		@DisplayName("Should ignore Retry-After values that are not whole seconds")
		void shouldIgnoreInvalidRetryAfter(String value) {
			assertThat(ErrorClassifier.parseRetryAfter(value)).isNull();
		}

	}

	@Nested
	@DisplayName("Server errors")
	class ServerErrorTest {

		@Test
		@DisplayName("Should tolerate the unnamed status line header")
		void shouldTolerateNullHeaderName() {
			Map<String, List<String>> headers = new LinkedHashMap<>();
			headers.put(null, List.of("HTTP/1.1 500 Internal Server Error"));
			headers.put("X-Request-Id", List.of("req-9"));

			ServerException error = (ServerException) classifier.classify(500, "x", headers);

			assertThat(error.getRequestId()).isEqualTo("req-9");
			assertThat(error.getHeaders()).containsOnlyKeys("X-Request-Id");
		}

		@Test
		@DisplayName("Should capture the request id header")
		void shouldCaptureRequestId() {
			ServerException error = (ServerException) classifier.classify(500, null,
					Map.of("X-Request-Id", List.of("req-42")));

			assertThat(error.getRequestId()).isEqualTo("req-42");
		}

		@Test
		@DisplayName("Should leave the request id absent when no header carries it")
		void shouldHandleMissingRequestId() {
			ServerException error = (ServerException) classifier.classify(503, null, Map.of());

			assertThat(error.getRequestId()).isNull();
			assertThat(error).isNotInstanceOf(IndexingInProgressException.class);
		}

		@Test
		@DisplayName("Should recognize an index that is still being built")
		void shouldRecognizeIndexing() {
			String body = "{\"errors\":[{\"msg\":\"Issues index is not ready, indexing in progress\"}]}";

			SonarQubeException error = classifier.classify(503, body, Map.of());

			assertThat(error).isInstanceOf(IndexingInProgressException.class);
			assertThat(error.getKind()).isEqualTo(ErrorKind.SERVER);
		}

		@Test
		@DisplayName("Should not treat indexing messages on other statuses specially")
		void shouldOnlyTreatIndexingOn503() {
			String body = "{\"errors\":[{\"msg\":\"indexing in progress\"}]}";

			assertThat(classifier.classify(500, body, Map.of())).isNotInstanceOf(IndexingInProgressException.class);
		}

	}

	@Nested
	@DisplayName("Transport failures")
	class TransportFailureTest {

		@Test
		@DisplayName("Should classify timeouts")
		void shouldClassifyTimeouts() {
			assertThat(classifier.classifyTransportFailure(new HttpTimeoutException("request timed out")))
				.isInstanceOf(RequestTimeoutException.class)
				.hasMessageContaining("request timed out");
			assertThat(classifier.classifyTransportFailure(new SocketTimeoutException("Read timed out")).getKind())
				.isEqualTo(ErrorKind.TIMEOUT);
		}

		@Test
		@DisplayName("Should classify other I/O failures as network errors")
		void shouldClassifyNetworkErrors() {
			ConnectException cause = new ConnectException("Connection refused");

			SonarQubeException error = classifier.classifyTransportFailure(cause);

			assertThat(error).isInstanceOf(NetworkException.class).hasCause(cause);
			assertThat(error.getStatusCode()).isNull();
		}

		@Test
		@DisplayName("Should pass already classified failures through")
		void shouldPassThroughClassified() {
			NotFoundException notFound = new NotFoundException("gone", null, Map.of());

			assertThat(classifier.classifyTransportFailure(notFound)).isSameAs(notFound);
		}

		@Test
		@DisplayName("Should describe failures without a message by their type")
		void shouldDescribeByType() {
			assertThat(classifier.classifyTransportFailure(new IOException())).hasMessage("Network error: IOException");
		}

	}

	@Nested
	@DisplayName("Removed endpoints")
	class RemovedApiTest {

		@Test
		@DisplayName("Should name the request path when the server answers 410")
		void shouldNameRequestPath() {
			SonarQubeException error = classifier.classify(410, "", Map.of(), "/api/user_properties/index");

			assertThat(error).isInstanceOf(RemovedApiException.class)
				.hasMessage("api/user_properties/index was removed");
			assertThat(((RemovedApiException) error).getCapability()).isEqualTo("api/user_properties/index");
		}

		@Test
		@DisplayName("Should keep the server message after the removed path")
		void shouldKeepServerMessage() {
			SonarQubeException error = classifier.classify(410, "{\"errors\":[{\"msg\":\"Use api/favorites\"}]}",
					Map.of(), "/api/user_properties");

			assertThat(error).hasMessage("api/user_properties was removed: Use api/favorites");
		}

		@Test
		@DisplayName("Should fall back to the status without a path")
		void shouldFallBackWithoutPath() {
			RemovedApiException error = (RemovedApiException) classifier.classify(410, null, Map.of());

			assertThat(error).hasMessage("HTTP 410");
			assertThat(error.getCapability()).isNull();
		}

		@Test
		@DisplayName("Should describe the removal and its replacements")
		void shouldDescribeRemoval() {
			Map<String, String> migration = new LinkedHashMap<>();
			migration.put("favorites", "favorites().search()");
			migration.put("notifications", "notifications().list()");

			RemovedApiException error = ErrorClassifier.removedApi("api/user_properties", "6.3", migration);

			assertThat(error).hasMessage(
					"api/user_properties was removed in SonarQube 6.3. Use favorites or notifications instead");
			assertThat(error.getStatusCode()).isEqualTo(410);
			assertThat(error.getKind()).isEqualTo(ErrorKind.REMOVED_API);
			assertThat(error.getReplacements()).containsExactly("favorites", "notifications");
			assertThat(error.getMigration()).containsEntry("favorites", "favorites().search()");
		}

	}

}
