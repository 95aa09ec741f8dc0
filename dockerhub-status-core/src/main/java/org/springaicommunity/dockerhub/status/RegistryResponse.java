package org.springaicommunity.dockerhub.status;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;

/**
 * A fully read response. Header lookups are case-insensitive.
 *
 * @param statusCode HTTP status code
 * @param headers response headers
 * @param body response body, empty for HEAD requests
 */
public record RegistryResponse(int statusCode, HttpHeaders headers, String body) {

	public static RegistryResponse of(int statusCode, Map<String, List<String>> headers, String body) {
		return new RegistryResponse(statusCode, HttpHeaders.of(headers, (name, value) -> true), body);
	}

	public static RegistryResponse of(int statusCode) {
		return of(statusCode, Map.of(), "");
	}

}
