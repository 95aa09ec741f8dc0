package org.springaicommunity.dockerhub.status.cli;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.dockerhub.status.DockerHubProperties;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Endpoint selection, both null = status as seen from this host
	public @Nullable Integer endpointId;

	public @Nullable String endpointsFile;

	// Ignore DOCKERHUB_USERNAME / DOCKERHUB_PASSWORD
	public boolean anonymous = false;

	// DockerHub overrides
	public String tokenUrl;

	public String rateLimitUrl;

	public int timeoutSeconds;

	public boolean verbose = false;

	public ParsedConfiguration(DockerHubProperties defaults) {
		this.tokenUrl = defaults.getTokenUrl();
		this.rateLimitUrl = defaults.getRateLimitUrl();
		this.timeoutSeconds = defaults.getRequestTimeoutSeconds();
	}

	public boolean isEndpointMode() {
		return endpointId != null;
	}

	/**
	 * Build DockerHub properties from this configuration.
	 * @return properties with the parsed URLs and timeout
	 */
	public DockerHubProperties toProperties() {
		DockerHubProperties properties = new DockerHubProperties();
		properties.setTokenUrl(tokenUrl);
		properties.setRateLimitUrl(rateLimitUrl);
		properties.setConnectTimeoutSeconds(timeoutSeconds);
		properties.setRequestTimeoutSeconds(timeoutSeconds);
		return properties;
	}

}
