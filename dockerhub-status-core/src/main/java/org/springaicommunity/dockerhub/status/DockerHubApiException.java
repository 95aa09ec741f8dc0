package org.springaicommunity.dockerhub.status;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a call to DockerHub fails.
 *
 * <p>
 * Carries the HTTP status code when a response was received, so callers can tell
 * rejected credentials apart from an upstream outage.
 */
public class DockerHubApiException extends RuntimeException {

	/**
	 * What went wrong during the call.
	 */
	public enum Reason {

		/** The request could not be sent or no response was received. */
		TRANSPORT,

		/** A response was received with a status other than 200. */
		UNEXPECTED_STATUS,

		/** The response body did not have the expected shape. */
		DECODE

	}

	private final Reason reason;

	private final int statusCode;

	public DockerHubApiException(String message, int statusCode) {
		super(message + " (status: " + statusCode + ")");
		this.reason = Reason.UNEXPECTED_STATUS;
		this.statusCode = statusCode;
	}

	public DockerHubApiException(Reason reason, String message, @Nullable Throwable cause) {
		super(message, cause);
		this.reason = reason;
		this.statusCode = -1;
	}

	public Reason getReason() {
		return reason;
	}

	/**
	 * Returns the HTTP status code, or -1 when no response status applies.
	 * @return the status code
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * Returns true if DockerHub rejected the credentials or the token (401 or 403).
	 */
	public boolean isAuthenticationFailure() {
		return statusCode == 401 || statusCode == 403;
	}

	/**
	 * Returns true if DockerHub answered with a server error (5xx).
	 */
	public boolean isServerError() {
		return statusCode >= 500 && statusCode < 600;
	}

}
