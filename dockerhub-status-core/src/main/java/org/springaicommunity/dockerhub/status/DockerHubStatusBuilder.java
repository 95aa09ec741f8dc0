package org.springaicommunity.dockerhub.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for creating DockerHub status services without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Status as seen from this server, credentials from the environment
 * DockerHubStatusService service = DockerHubStatusBuilder.create().buildStatusService();
 * RateLimitStatus status = service.getStatus(new EnvironmentCredentialsStore().getCredentials());
 *
 * // Endpoint-aware handler
 * DockerHubStatusHandler handler = DockerHubStatusBuilder.create()
 *     .properties(props)
 *     .buildHandler(new FileSystemEndpointRepository(path, mapper), new EnvironmentCredentialsStore());
 * HandlerResponse response = handler.handle("1");
 *
 * // For testing with a mock transport
 * RegistryTransport transport = mock(RegistryTransport.class);
 * DockerHubStatusService testService = DockerHubStatusBuilder.create()
 *     .transport(transport)
 *     .buildStatusService();
 * }
 * </pre>
 */
public class DockerHubStatusBuilder {

	private DockerHubProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private RegistryTransport transport;

	private DockerHubStatusBuilder() {
		this.properties = new DockerHubProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new DockerHubStatusBuilder
	 */
	public static DockerHubStatusBuilder create() {
		return new DockerHubStatusBuilder();
	}

	/**
	 * Set configuration properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public DockerHubStatusBuilder properties(@Nullable DockerHubProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public DockerHubStatusBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom transport. Useful for testing with mocks or for sharing a configured
	 * HTTP client.
	 * @param transport custom RegistryTransport (null to use {@link JdkRegistryTransport})
	 * @return this builder
	 */
	public DockerHubStatusBuilder transport(@Nullable RegistryTransport transport) {
		this.transport = transport;
		return this;
	}

	/**
	 * Build a DockerHubStatusService.
	 * @return configured DockerHubStatusService
	 */
	public DockerHubStatusService buildStatusService() {
		return buildStatusService(resolveObjectMapper());
	}

	/**
	 * Build a DockerHubStatusHandler.
	 * @param endpointRepository endpoint lookup
	 * @param credentialsStore stored credentials
	 * @return configured DockerHubStatusHandler
	 */
	public DockerHubStatusHandler buildHandler(EndpointRepository endpointRepository,
			DockerHubCredentialsStore credentialsStore) {
		ObjectMapper mapper = resolveObjectMapper();
		return new DockerHubStatusHandler(endpointRepository, credentialsStore, buildStatusService(mapper), mapper);
	}

	private DockerHubStatusService buildStatusService(ObjectMapper mapper) {
		RegistryTransport registryTransport = this.transport != null ? this.transport
				: new JdkRegistryTransport(properties);
		return new DockerHubStatusService(new DockerHubTokenClient(registryTransport, mapper, properties),
				new DockerHubRateLimitClient(registryTransport, properties));
	}

	private ObjectMapper resolveObjectMapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

}
