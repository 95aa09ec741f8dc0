package org.springaicommunity.dockerhub.status;

/**
 * Thrown when a rate-limit header of a successful response is missing or malformed. The
 * cause is the underlying {@link MissingHeaderException} or {@link NumberFormatException}.
 */
public class RateLimitHeaderException extends RuntimeException {

	private final String headerName;

	public RateLimitHeaderException(String headerName, RuntimeException cause) {
		super("Failed fetching " + headerName + " header: " + cause.getMessage(), cause);
		this.headerName = headerName;
	}

	public String getHeaderName() {
		return headerName;
	}

}
