package org.springaicommunity.dockerhub.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Obtains a bearer token from the DockerHub auth service with pull scope on the
 * rate-limit preview repository.
 *
 * <p>
 * Tokens are returned to the caller only; they are neither cached nor logged.
 */
public class DockerHubTokenClient {

	private static final Logger logger = LoggerFactory.getLogger(DockerHubTokenClient.class);

	private final RegistryTransport transport;

	private final ObjectMapper objectMapper;

	private final URI tokenUri;

	public DockerHubTokenClient(RegistryTransport transport, ObjectMapper objectMapper, DockerHubProperties properties) {
		this.transport = transport;
		this.objectMapper = objectMapper;
		this.tokenUri = URI.create(properties.getTokenUrl());
	}

	/**
	 * Request a token, authenticating with basic credentials when they are enabled.
	 * @param credentials stored credentials
	 * @return the bearer token
	 * @throws DockerHubApiException if the request fails, the status is not 200, or the
	 * body is not a token response
	 */
	public String acquireToken(DockerHubCredentials credentials) {
		RegistryRequest request = RegistryRequest.get(tokenUri);
		if (credentials.authentication()) {
			request = request.withHeader("Authorization", basicAuth(credentials.username(), credentials.password()));
		}
		logger.debug("Requesting DockerHub token (authenticated: {})", credentials.authentication());

		RegistryResponse response = transport.execute(request);
		if (response.statusCode() != 200) {
			throw new DockerHubApiException("Failed fetching DockerHub token", response.statusCode());
		}

		TokenResponse tokenResponse;
		try {
			tokenResponse = objectMapper.readValue(response.body(), TokenResponse.class);
		}
		catch (JsonProcessingException e) {
			throw new DockerHubApiException(DockerHubApiException.Reason.DECODE,
					"Failed decoding DockerHub token response: " + e.getOriginalMessage(), e);
		}

		if (tokenResponse == null || tokenResponse.token() == null || tokenResponse.token().isBlank()) {
			throw new DockerHubApiException(DockerHubApiException.Reason.DECODE,
					"DockerHub token response does not contain a token", null);
		}
		return tokenResponse.token();
	}

	private static String basicAuth(@Nullable String username, @Nullable String password) {
		String pair = (username == null ? "" : username) + ":" + (password == null ? "" : password);
		return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
	}

	record TokenResponse(@Nullable String token) {
	}

}
