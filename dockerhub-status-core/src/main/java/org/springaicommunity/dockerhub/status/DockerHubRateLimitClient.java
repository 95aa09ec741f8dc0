package org.springaicommunity.dockerhub.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Reads the pull rate limit by probing the rate-limit preview manifest with a HEAD
 * request. A HEAD request does not count as a pull.
 */
public class DockerHubRateLimitClient {

	private static final Logger logger = LoggerFactory.getLogger(DockerHubRateLimitClient.class);

	static final String RATE_LIMIT_HEADER = "RateLimit-Limit";

	static final String RATE_LIMIT_REMAINING_HEADER = "RateLimit-Remaining";

	private final RegistryTransport transport;

	private final URI rateLimitUri;

	public DockerHubRateLimitClient(RegistryTransport transport, DockerHubProperties properties) {
		this.transport = transport;
		this.rateLimitUri = URI.create(properties.getRateLimitUrl());
	}

	/**
	 * Fetch the current rate limit status.
	 * @param token bearer token from {@link DockerHubTokenClient}
	 * @return limit and remaining pulls, both present
	 * @throws DockerHubApiException if the request fails or the status is not 200
	 * @throws RateLimitHeaderException if either header is missing or malformed
	 */
	public RateLimitStatus fetchRateLimits(String token) {
		RegistryRequest request = RegistryRequest.head(rateLimitUri).withHeader("Authorization", "Bearer " + token);

		RegistryResponse response = transport.execute(request);
		if (response.statusCode() != 200) {
			throw new DockerHubApiException("Failed fetching DockerHub rate limits", response.statusCode());
		}

		int limit = parseHeader(response, RATE_LIMIT_HEADER);
		int remaining = parseHeader(response, RATE_LIMIT_REMAINING_HEADER);

		if (remaining < limit / 10) {
			logger.info("DockerHub pull rate limit low: {}/{} remaining", remaining, limit);
		}
		else {
			logger.debug("DockerHub pull rate limit: {}/{} remaining", remaining, limit);
		}
		return new RateLimitStatus(limit, remaining);
	}

	private static int parseHeader(RegistryResponse response, String headerName) {
		try {
			return NumericHeaderParser.parse(response.headers(), headerName);
		}
		catch (MissingHeaderException | NumberFormatException e) {
			throw new RateLimitHeaderException(headerName, e);
		}
	}

}
