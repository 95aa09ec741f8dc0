package org.springaicommunity.dockerhub.status;

import org.jspecify.annotations.Nullable;

/**
 * A managed container runtime endpoint.
 *
 * @param id endpoint identifier
 * @param name display name
 * @param url connection address (e.g. {@code unix:///var/run/docker.sock})
 * @param type kind of environment
 */
public record Endpoint(int id, @Nullable String name, String url, EndpointType type) {

	public Endpoint {
		if (url == null) {
			throw new IllegalArgumentException("Endpoint " + id + " has no url");
		}
		if (type == null) {
			throw new IllegalArgumentException("Endpoint " + id + " has no type");
		}
	}

}
