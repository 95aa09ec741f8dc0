package org.springaicommunity.dockerhub.status;

import java.net.http.HttpHeaders;
import java.util.regex.Pattern;

/**
 * Parses numeric rate-limit headers.
 *
 * <p>
 * DockerHub appends a policy suffix to the count, e.g. {@code 100;w=21600} for 100 pulls
 * per 21600 seconds. Only the segment before the first {@code ;} is read.
 */
public final class NumericHeaderParser {

	private static final Pattern COUNT = Pattern.compile("\\+?[0-9]+");

	private NumericHeaderParser() {
	}

	/**
	 * Parse the first {@code ;}-separated segment of a header as a base-10 integer of
	 * ASCII digits.
	 * @param headers response headers
	 * @param headerName header to read
	 * @return the parsed value, never negative
	 * @throws MissingHeaderException if the header is absent or empty
	 * @throws NumberFormatException if the first segment is not a non-negative integer
	 */
	public static int parse(HttpHeaders headers, String headerName) {
		String headerValue = headers.firstValue(headerName).orElse("");
		if (headerValue.isEmpty()) {
			throw new MissingHeaderException(headerName);
		}

		String count = headerValue.split(";", 2)[0].trim();
		if (!COUNT.matcher(count).matches()) {
			throw new NumberFormatException("Not a non-negative ASCII integer: \"" + count + "\"");
		}
		return Integer.parseInt(count);
	}

}
