package org.springaicommunity.dockerhub.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles {@code GET /api/endpoints/{id}/dockerhub/status}.
 *
 * <p>
 * Looks up the endpoint, rejects endpoints without this server's DockerHub egress before
 * any outbound call, loads the stored credentials and runs
 * {@link DockerHubStatusService}. Errors are written as
 * {@code {"message": ..., "details": ...}}; a partial status is never written.
 */
public class DockerHubStatusHandler {

	private static final Logger logger = LoggerFactory.getLogger(DockerHubStatusHandler.class);

	private final EndpointRepository endpointRepository;

	private final DockerHubCredentialsStore credentialsStore;

	private final DockerHubStatusService statusService;

	private final ObjectMapper objectMapper;

	public DockerHubStatusHandler(EndpointRepository endpointRepository, DockerHubCredentialsStore credentialsStore,
			DockerHubStatusService statusService, ObjectMapper objectMapper) {
		this.endpointRepository = endpointRepository;
		this.credentialsStore = credentialsStore;
		this.statusService = statusService;
		this.objectMapper = objectMapper;
	}

	/**
	 * Handle a request for the given route variable.
	 * @param endpointIdVariable raw {@code id} route variable
	 * @return 200 with {@code {"remaining": int, "limit": int}}, or an error response
	 */
	public HandlerResponse handle(@Nullable String endpointIdVariable) {
		try {
			int endpointId = parseEndpointId(endpointIdVariable);
			RateLimitStatus status = getStatus(endpointId);
			return new HandlerResponse(200, writeJson(status));
		}
		catch (DockerHubStatusException e) {
			logger.warn("DockerHub status request failed: {} (err={}) (code={})", e.getMessage(), details(e),
					e.getHttpStatus());
			return errorResponse(e);
		}
	}

	/**
	 * Render a failure as {@code {"message": ..., "details": ...}} with its HTTP status.
	 * @param e the failure
	 * @return the error response
	 */
	public HandlerResponse errorResponse(DockerHubStatusException e) {
		Map<String, String> error = new LinkedHashMap<>();
		error.put("message", e.getMessage());
		error.put("details", details(e));
		return new HandlerResponse(e.getHttpStatus(), writeJson(error));
	}

	/**
	 * Get the DockerHub status for an endpoint.
	 * @param endpointId endpoint identifier
	 * @return limit and remaining pulls
	 * @throws DockerHubStatusException if the endpoint is missing or unsupported, the
	 * credentials cannot be read, or a DockerHub call fails
	 */
	public RateLimitStatus getStatus(int endpointId) {
		Endpoint endpoint = findEndpoint(endpointId);

		if (!DockerHubEgressPolicy.isSupported(endpoint)) {
			throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.UNSUPPORTED_ENDPOINT_TYPE,
					"Invalid environment type");
		}

		DockerHubCredentials credentials;
		try {
			credentials = credentialsStore.getCredentials();
		}
		catch (RuntimeException e) {
			throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.INTERNAL,
					"Unable to retrieve DockerHub details from the database", e);
		}

		return statusService.getStatus(credentials);
	}

	static int parseEndpointId(@Nullable String endpointIdVariable) {
		if (endpointIdVariable == null || endpointIdVariable.isBlank()) {
			throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.INVALID_INPUT,
					"Invalid endpoint identifier route variable");
		}
		try {
			int endpointId = Integer.parseInt(endpointIdVariable.trim());
			if (endpointId <= 0) {
				throw new NumberFormatException("Endpoint identifier must be positive: " + endpointId);
			}
			return endpointId;
		}
		catch (NumberFormatException e) {
			throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.INVALID_INPUT,
					"Invalid endpoint identifier route variable", e);
		}
	}

	private Endpoint findEndpoint(int endpointId) {
		EndpointLookup lookup = endpointRepository.findEndpoint(endpointId);
		if (lookup instanceof EndpointLookup.Found found) {
			return found.endpoint();
		}
		if (lookup instanceof EndpointLookup.NotFound) {
			throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.NOT_FOUND,
					"Unable to find an endpoint with the specified identifier inside the database");
		}
		throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.INTERNAL,
				"Unable to find an endpoint with the specified identifier inside the database",
				((EndpointLookup.Failed) lookup).cause());
	}

	private static String details(DockerHubStatusException e) {
		Throwable cause = e.getCause();
		if (cause != null && cause.getMessage() != null) {
			return cause.getMessage();
		}
		return e.getMessage();
	}

	private String writeJson(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed writing response body", e);
		}
	}

}
