package org.springaicommunity.dockerhub.status;

/**
 * Source of the stored DockerHub credentials.
 */
@FunctionalInterface
public interface DockerHubCredentialsStore {

	/**
	 * Get the stored credentials.
	 * @return credentials, {@link DockerHubCredentials#anonymous()} when none are stored
	 * @throws RuntimeException if the credentials cannot be read
	 */
	DockerHubCredentials getCredentials();

}
