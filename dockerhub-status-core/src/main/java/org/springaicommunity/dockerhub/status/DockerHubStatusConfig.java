package org.springaicommunity.dockerhub.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the DockerHub status beans.
 *
 * <p>
 * The application context must provide an {@link EndpointRepository} and a
 * {@link DockerHubCredentialsStore} for the handler.
 */
@Configuration
public class DockerHubStatusConfig {

	@Value("${dockerhub.token-url:" + DockerHubProperties.DEFAULT_TOKEN_URL + "}")
	private String tokenUrl;

	@Value("${dockerhub.rate-limit-url:" + DockerHubProperties.DEFAULT_RATE_LIMIT_URL + "}")
	private String rateLimitUrl;

	@Value("${dockerhub.connect-timeout-seconds:30}")
	private int connectTimeoutSeconds;

	@Value("${dockerhub.request-timeout-seconds:30}")
	private int requestTimeoutSeconds;

	@Bean
	public DockerHubProperties dockerHubProperties() {
		DockerHubProperties properties = new DockerHubProperties();
		properties.setTokenUrl(tokenUrl);
		properties.setRateLimitUrl(rateLimitUrl);
		properties.setConnectTimeoutSeconds(connectTimeoutSeconds);
		properties.setRequestTimeoutSeconds(requestTimeoutSeconds);
		return properties;
	}

	@Bean
	public ObjectMapper dockerHubObjectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public RegistryTransport registryTransport(DockerHubProperties dockerHubProperties) {
		return new JdkRegistryTransport(dockerHubProperties);
	}

	@Bean
	public DockerHubStatusService dockerHubStatusService(RegistryTransport registryTransport,
			ObjectMapper dockerHubObjectMapper, DockerHubProperties dockerHubProperties) {
		return new DockerHubStatusService(
				new DockerHubTokenClient(registryTransport, dockerHubObjectMapper, dockerHubProperties),
				new DockerHubRateLimitClient(registryTransport, dockerHubProperties));
	}

	@Bean
	public DockerHubStatusHandler dockerHubStatusHandler(EndpointRepository endpointRepository,
			DockerHubCredentialsStore credentialsStore, DockerHubStatusService dockerHubStatusService,
			ObjectMapper dockerHubObjectMapper) {
		return new DockerHubStatusHandler(endpointRepository, credentialsStore, dockerHubStatusService,
				dockerHubObjectMapper);
	}

}
