package org.springaicommunity.dockerhub.status;

/**
 * HTTP status and JSON body produced by {@link DockerHubStatusHandler}.
 *
 * @param statusCode HTTP status code
 * @param body JSON body
 */
public record HandlerResponse(int statusCode, String body) {

	public boolean isSuccess() {
		return statusCode == 200;
	}

}
