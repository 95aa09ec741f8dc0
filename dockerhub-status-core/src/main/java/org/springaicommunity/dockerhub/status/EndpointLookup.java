package org.springaicommunity.dockerhub.status;

/**
 * Result of looking up an endpoint by identifier.
 *
 * <p>
 * Lets callers tell a missing endpoint apart from a storage failure without comparing
 * exception identities.
 */
public sealed interface EndpointLookup permits EndpointLookup.Found, EndpointLookup.NotFound, EndpointLookup.Failed {

	static EndpointLookup found(Endpoint endpoint) {
		return new Found(endpoint);
	}

	static EndpointLookup notFound(int endpointId) {
		return new NotFound(endpointId);
	}

	static EndpointLookup failed(Exception cause) {
		return new Failed(cause);
	}

	record Found(Endpoint endpoint) implements EndpointLookup {
	}

	record NotFound(int endpointId) implements EndpointLookup {
	}

	record Failed(Exception cause) implements EndpointLookup {
	}

}
