package org.springaicommunity.dockerhub.status;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outbound request without a body.
 *
 * @param method HTTP method
 * @param uri target URI
 * @param headers request headers
 */
public record RegistryRequest(String method, URI uri, Map<String, String> headers) {

	public RegistryRequest {
		headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
	}

	public static RegistryRequest get(URI uri) {
		return new RegistryRequest("GET", uri, Map.of());
	}

	public static RegistryRequest head(URI uri) {
		return new RegistryRequest("HEAD", uri, Map.of());
	}

	/**
	 * Returns a copy of this request with an additional header.
	 * @param name header name
	 * @param value header value
	 * @return new request
	 */
	public RegistryRequest withHeader(String name, String value) {
		Map<String, String> copy = new LinkedHashMap<>(headers);
		copy.put(name, value);
		return new RegistryRequest(method, uri, copy);
	}

	// Header values carry credentials
	@Override
	public String toString() {
		return "RegistryRequest[" + method + " " + uri + ", headers=" + headers.keySet() + "]";
	}

}
