package org.springaicommunity.dockerhub.status;

/**
 * Decides for which endpoints the DockerHub status seen from this server is meaningful.
 *
 * <p>
 * Only runtimes reached through a local socket or pipe, and the local Kubernetes
 * environment, pull images over this server's own network path.
 */
public final class DockerHubEgressPolicy {

	private DockerHubEgressPolicy() {
	}

	public static boolean isSupported(Endpoint endpoint) {
		return endpoint.url().startsWith("unix://") || endpoint.url().startsWith("npipe://")
				|| endpoint.type() == EndpointType.KUBERNETES_LOCAL;
	}

}
