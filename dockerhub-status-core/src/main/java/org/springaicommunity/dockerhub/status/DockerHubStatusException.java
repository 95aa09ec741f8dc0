package org.springaicommunity.dockerhub.status;

/**
 * Failure of a DockerHub status retrieval, classified by {@link ErrorKind}.
 *
 * <p>
 * The message is safe to show to API clients; the cause holds the underlying error.
 */
public class DockerHubStatusException extends RuntimeException {

	/**
	 * Failure classification and the HTTP status it maps to.
	 */
	public enum ErrorKind {

		INVALID_INPUT(400),

		NOT_FOUND(404),

		UNSUPPORTED_ENDPOINT_TYPE(400),

		UPSTREAM_AUTH(500),

		UPSTREAM_RATE_LIMIT(500),

		UPSTREAM_PROTOCOL(500),

		INTERNAL(500);

		private final int httpStatus;

		ErrorKind(int httpStatus) {
			this.httpStatus = httpStatus;
		}

		public int getHttpStatus() {
			return httpStatus;
		}

	}

	private final ErrorKind kind;

	public DockerHubStatusException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public DockerHubStatusException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

	public int getHttpStatus() {
		return kind.getHttpStatus();
	}

}
