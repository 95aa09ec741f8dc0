package org.springaicommunity.dockerhub.status;

/**
 * HTTP transport used for the outbound DockerHub calls.
 *
 * <p>
 * Implementations must be safe for concurrent use and must release the connection of
 * every response, whatever its status. Non-2xx statuses are returned, not thrown; the
 * callers decide what a status means.
 */
public interface RegistryTransport {

	/**
	 * Execute a request and read the complete response.
	 * @param request the request
	 * @return the response
	 * @throws DockerHubApiException with reason {@code TRANSPORT} if no response was
	 * received
	 */
	RegistryResponse execute(RegistryRequest request);

}
