package org.springaicommunity.dockerhub.status;

/**
 * Read access to persisted endpoints.
 */
public interface EndpointRepository {

	/**
	 * Find an endpoint by identifier. Implementations report storage errors as
	 * {@link EndpointLookup.Failed} rather than throwing.
	 * @param endpointId endpoint identifier
	 * @return the lookup result
	 */
	EndpointLookup findEndpoint(int endpointId);

}
