package org.springaicommunity.dockerhub.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Spring context tests for {@link DockerHubStatusConfig}.
 *
 * SAFETY PROTOCOL: the DockerHub URLs point at an unroutable local address and no test
 * triggers an outbound call, so no request ever reaches DockerHub.
 */
@SpringJUnitConfig(classes = { DockerHubStatusConfig.class, SpringContextTest.TestConfig.class })
@TestPropertySource(properties = { "dockerhub.token-url=http://127.0.0.1:9/token",
		"dockerhub.rate-limit-url=http://127.0.0.1:9/v2/ratelimitpreview/test/manifests/latest",
		"dockerhub.request-timeout-seconds=5" })
@DisplayName("DockerHub Status - Spring Context Tests")
class SpringContextTest {

	@Configuration
	static class TestConfig {

		@Bean
		EndpointRepository endpointRepository() {
			Map<Integer, Endpoint> endpoints = Map.of(1,
					new Endpoint(1, "remote", "tcp://10.0.0.5:2375", EndpointType.DOCKER));
			return id -> endpoints.containsKey(id) ? EndpointLookup.found(endpoints.get(id))
					: EndpointLookup.notFound(id);
		}

		@Bean
		DockerHubCredentialsStore credentialsStore() {
			return DockerHubCredentials::anonymous;
		}

	}

	@Autowired
	private DockerHubProperties properties;

	@Autowired
	private RegistryTransport transport;

	@Autowired
	private DockerHubStatusHandler handler;

	@Test
	@DisplayName("Should bind dockerhub properties and keep defaults for unset ones")
	void shouldBindProperties() {
		assertThat(properties.getTokenUrl()).isEqualTo("http://127.0.0.1:9/token");
		assertThat(properties.getRateLimitUrl()).endsWith("/v2/ratelimitpreview/test/manifests/latest");
		assertThat(properties.getRequestTimeoutSeconds()).isEqualTo(5);
		assertThat(properties.getConnectTimeoutSeconds()).isEqualTo(30);
	}

	@Test
	@DisplayName("Should wire the JDK transport")
	void shouldWireTransport() {
		assertThat(transport).isInstanceOf(JdkRegistryTransport.class);
	}

	@Test
	@DisplayName("Should wire the handler with the context's endpoint repository")
	void shouldWireHandler() {
		assertThat(handler.handle("1").statusCode()).isEqualTo(400);
		assertThat(handler.handle("2").statusCode()).isEqualTo(404);
	}

}
