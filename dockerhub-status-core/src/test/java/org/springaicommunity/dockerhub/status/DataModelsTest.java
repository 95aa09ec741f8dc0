package org.springaicommunity.dockerhub.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the record and enum definitions: validation, JSON shape and redaction.
 */
@DisplayName("DataModels Tests")
class DataModelsTest {

	private ObjectMapper objectMapper;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
	}

	@Nested
	@DisplayName("RateLimitStatus")
	class RateLimitStatusTest {

		@Test
		@DisplayName("Should serialize as remaining then limit")
		void shouldSerializeResponseShape() throws JsonProcessingException {
			assertThat(objectMapper.writeValueAsString(new RateLimitStatus(100, 17)))
				.isEqualTo("{\"remaining\":17,\"limit\":100}");
		}

		@Test
		@DisplayName("Should reject negative values")
		void shouldRejectNegativeValues() {
			assertThatThrownBy(() -> new RateLimitStatus(-1, 0)).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new RateLimitStatus(100, -1)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("DockerHubCredentials")
	class CredentialsTest {

		@Test
		@DisplayName("Should not print the password")
		void shouldRedactPassword() {
			assertThat(DockerHubCredentials.of("octo", "pa55").toString()).contains("octo")
				.doesNotContain("pa55");
		}

		@Test
		@DisplayName("Should require a username when authentication is enabled")
		void shouldRequireUsername() {
			assertThatThrownBy(() -> new DockerHubCredentials(true, null, "pa55"))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("RegistryRequest")
	class RegistryRequestTest {

		@Test
		@DisplayName("Should not print header values")
		void shouldNotPrintHeaderValues() {
			RegistryRequest request = RegistryRequest.head(URI.create("http://registry.test/manifest"))
				.withHeader("Authorization", "Bearer abc123");

			assertThat(request.toString()).contains("Authorization").doesNotContain("abc123");
		}

		@Test
		@DisplayName("Should leave the original request unchanged when adding headers")
		void shouldCopyOnWithHeader() {
			RegistryRequest original = RegistryRequest.get(URI.create("http://auth.test/token"));

			original.withHeader("Authorization", "Basic xyz");

			assertThat(original.headers()).isEmpty();
		}

	}

	@Nested
	@DisplayName("Endpoint")
	class EndpointTest {

		@Test
		@DisplayName("Should require url and type")
		void shouldRequireUrlAndType() {
			assertThatThrownBy(() -> new Endpoint(1, "local", null, EndpointType.DOCKER))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("url");
			assertThatThrownBy(() -> new Endpoint(1, "local", "unix:///var/run/docker.sock", null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("type");
		}

	}

	@Nested
	@DisplayName("EndpointType")
	class EndpointTypeTest {

		@Test
		@DisplayName("Should map persisted ids to types")
		void shouldMapIds() throws JsonProcessingException {
			assertThat(EndpointType.fromId(5)).isEqualTo(EndpointType.KUBERNETES_LOCAL);
			assertThat(objectMapper.readValue("1", EndpointType.class)).isEqualTo(EndpointType.DOCKER);
			assertThat(objectMapper.writeValueAsString(EndpointType.EDGE_AGENT_ON_KUBERNETES)).isEqualTo("7");
		}

		@Test
		@DisplayName("Should reject unknown ids")
		void shouldRejectUnknownIds() {
			assertThatThrownBy(() -> EndpointType.fromId(0)).isInstanceOf(IllegalArgumentException.class);
		}

	}

}
