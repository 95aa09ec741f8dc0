package org.springaicommunity.dockerhub.status;

/**
 * Configuration properties for DockerHub status retrieval.
 *
 * <p>
 * Default values target DockerHub's public auth service and registry. The URLs can be
 * pointed at local fixtures, which is how the tests run without network access.
 */
public class DockerHubProperties {

	/**
	 * Auth service URL requesting pull scope on the rate-limit preview repository.
	 */
	public static final String DEFAULT_TOKEN_URL = "https://auth.docker.io/token?service=registry.docker.io&scope=repository:ratelimitpreview/test:pull";

	/**
	 * Manifest of the rate-limit preview repository. Only probed with HEAD.
	 */
	public static final String DEFAULT_RATE_LIMIT_URL = "https://registry-1.docker.io/v2/ratelimitpreview/test/manifests/latest";

	private String tokenUrl = DEFAULT_TOKEN_URL;

	private String rateLimitUrl = DEFAULT_RATE_LIMIT_URL;

	/**
	 * Timeout in seconds for establishing a connection.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * Timeout in seconds for a complete request/response exchange.
	 */
	private int requestTimeoutSeconds = 30;

	private String userAgent = "dockerhub-status";

	public String getTokenUrl() {
		return tokenUrl;
	}

	public void setTokenUrl(String tokenUrl) {
		this.tokenUrl = tokenUrl;
	}

	public String getRateLimitUrl() {
		return rateLimitUrl;
	}

	public void setRateLimitUrl(String rateLimitUrl) {
		this.rateLimitUrl = rateLimitUrl;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	/**
	 * Sets the connect timeout.
	 * @param connectTimeoutSeconds timeout in seconds, must be positive
	 */
	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		if (connectTimeoutSeconds <= 0) {
			throw new IllegalArgumentException("Connect timeout must be positive: " + connectTimeoutSeconds);
		}
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	/**
	 * Sets the request timeout.
	 * @param requestTimeoutSeconds timeout in seconds, must be positive
	 */
	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		if (requestTimeoutSeconds <= 0) {
			throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeoutSeconds);
		}
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

}
