package org.springaicommunity.dockerhub.status;

/**
 * Thrown when a required response header is absent or empty.
 */
public class MissingHeaderException extends RuntimeException {

	private final String headerName;

	public MissingHeaderException(String headerName) {
		super("Missing " + headerName + " header");
		this.headerName = headerName;
	}

	public String getHeaderName() {
		return headerName;
	}

}
