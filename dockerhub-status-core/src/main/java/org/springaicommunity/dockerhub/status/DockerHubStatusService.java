package org.springaicommunity.dockerhub.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieves the DockerHub pull rate limit as seen from this server.
 *
 * <p>
 * Runs two steps in order: acquire a token, then fetch the rate limits with it. The
 * second call is never made when the first fails. Nothing is cached or retried; every
 * call performs both requests.
 */
public class DockerHubStatusService {

	private static final Logger logger = LoggerFactory.getLogger(DockerHubStatusService.class);

	private final DockerHubTokenClient tokenClient;

	private final DockerHubRateLimitClient rateLimitClient;

	public DockerHubStatusService(DockerHubTokenClient tokenClient, DockerHubRateLimitClient rateLimitClient) {
		this.tokenClient = tokenClient;
		this.rateLimitClient = rateLimitClient;
	}

	/**
	 * Get the current rate limit status.
	 * @param credentials stored credentials used for the token request
	 * @return limit and remaining pulls
	 * @throws DockerHubStatusException with kind {@code UPSTREAM_AUTH},
	 * {@code UPSTREAM_RATE_LIMIT} or {@code UPSTREAM_PROTOCOL}
	 */
	public RateLimitStatus getStatus(DockerHubCredentials credentials) {
		String token = acquireToken(credentials);
		return fetchRateLimits(token);
	}

	private String acquireToken(DockerHubCredentials credentials) {
		try {
			String token = tokenClient.acquireToken(credentials);
			logger.debug("Received DockerHub token");
			return token;
		}
		catch (DockerHubApiException e) {
			if (e.isAuthenticationFailure()) {
				logger.warn("DockerHub rejected the token request (status {}), check the stored credentials",
						e.getStatusCode());
			}
			throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.UPSTREAM_AUTH,
					"Unable to retrieve DockerHub token from DockerHub", e);
		}
	}

	private RateLimitStatus fetchRateLimits(String token) {
		try {
			return rateLimitClient.fetchRateLimits(token);
		}
		catch (RateLimitHeaderException e) {
			throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.UPSTREAM_PROTOCOL,
					"Unable to retrieve DockerHub rate limits from DockerHub", e);
		}
		catch (DockerHubApiException e) {
			throw new DockerHubStatusException(DockerHubStatusException.ErrorKind.UPSTREAM_RATE_LIMIT,
					"Unable to retrieve DockerHub rate limits from DockerHub", e);
		}
	}

}
