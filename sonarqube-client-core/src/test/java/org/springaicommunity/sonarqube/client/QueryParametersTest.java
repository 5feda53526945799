package org.springaicommunity.sonarqube.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("QueryParameters Tests")
class QueryParametersTest {

	@Nested
	@DisplayName("Storing values")
	class StoringTest {

		@Test
		@DisplayName("Should ignore null values")
		void shouldIgnoreNullValues() {
			QueryParameters params = QueryParameters.create().set("q", null);

			assertThat(params.isEmpty()).isTrue();
			assertThat(params.contains("q")).isFalse();
		}

		@Test
		@DisplayName("Should keep the last value written for a name")
		void shouldKeepLastValue() {
			QueryParameters params = QueryParameters.create().set("ps", 10).set("ps", 50);

			assertThat(params.get("ps")).isEqualTo(50);
			assertThat(params.asMap()).hasSize(1);
		}

		@Test
		@DisplayName("Should not let a null value erase an earlier one")
		void shouldNotEraseWithNull() {
			QueryParameters params = QueryParameters.create().set("branch", "main").set("branch", null);

			assertThat(params.get("branch")).isEqualTo("main");
		}

		@Test
		@DisplayName("Should copy independently")
		void shouldCopyIndependently() {
			QueryParameters original = QueryParameters.create().set("q", "foo");
			QueryParameters copy = original.copy();

			original.set("q", "bar").set("p", 2);

			assertThat(copy.get("q")).isEqualTo("foo");
			assertThat(copy.contains("p")).isFalse();
			assertThat(copy).isNotEqualTo(original);
		}

		@Test
		@DisplayName("Should not be affected by later changes to a stored collection")
		void shouldSnapshotCollections() {
			List<String> keys = new ArrayList<>(List.of("a"));
			QueryParameters params = QueryParameters.create().set("projects", keys);

			keys.add("b");

			assertThat(params.get("projects")).isEqualTo(List.of("a"));
		}

	}

	@Nested
	@DisplayName("Serialization")
	class SerializationTest {

		@Test
		@DisplayName("Should join collections with commas")
		void shouldJoinCollections() {
			QueryParameters params = QueryParameters.create().set("projects", List.of("a", "b", "c"));

			assertThat(params.toQueryString()).isEqualTo("projects=a%2Cb%2Cc");
		}

		@Test
		@DisplayName("Should omit empty collections")
		void shouldOmitEmptyCollections() {
			QueryParameters params = QueryParameters.create().set("tags", List.of()).set("q", "x");

			assertThat(params.toQueryString()).isEqualTo("q=x");
		}

		@Test
		@DisplayName("Should use wire spelling for enums that define one")
		void shouldUseWireSpelling() {
			QueryParameters params = QueryParameters.create()
				.set("transition", IssueTransition.FALSE_POSITIVE)
				.set("qualifiers", List.of(ComponentQualifier.PROJECT, ComponentQualifier.APPLICATION));

			assertThat(params.toQueryString()).isEqualTo("transition=falsepositive&qualifiers=TRK%2CAPP");
		}

		@Test
		@DisplayName("Should use constant names for plain enums")
		void shouldUseEnumNames() {
			QueryParameters params = QueryParameters.create().set("status", HotspotStatus.TO_REVIEW);

			assertThat(params.toQueryString()).isEqualTo("status=TO_REVIEW");
		}

		@Test
		@DisplayName("Should encode reserved characters and keep insertion order")
		void shouldEncodeAndKeepOrder() {
			QueryParameters params = QueryParameters.create()
				.set("q", "a b&c")
				.set("resolved", false)
				.set("p", 2);

			assertThat(params.toQueryString()).isEqualTo("q=a+b%26c&resolved=false&p=2");
		}

		@Test
		@DisplayName("Should serialize an empty bag to an empty string")
		void shouldSerializeEmptyBag() {
			assertThat(QueryParameters.create().toQueryString()).isEmpty();
		}

	}

}
