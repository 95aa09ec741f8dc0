package org.springaicommunity.dockerhub.status;

import org.jspecify.annotations.Nullable;

/**
 * Stored DockerHub credentials.
 *
 * <p>
 * Basic credentials are only sent to the auth service when {@code authentication} is
 * true. The password is never included in {@link #toString()}.
 *
 * @param authentication whether the token request should be authenticated
 * @param username DockerHub username, or null
 * @param password DockerHub password or access token, or null
 */
public record DockerHubCredentials(boolean authentication, @Nullable String username, @Nullable String password) {

	public DockerHubCredentials {
		if (authentication && (username == null || username.isBlank())) {
			throw new IllegalArgumentException("A username is required when authentication is enabled");
		}
	}

	/**
	 * Credentials for anonymous token requests.
	 * @return credentials with authentication disabled
	 */
	public static DockerHubCredentials anonymous() {
		return new DockerHubCredentials(false, null, null);
	}

	/**
	 * Credentials for authenticated token requests.
	 * @param username DockerHub username
	 * @param password DockerHub password or personal access token
	 * @return credentials with authentication enabled
	 */
	public static DockerHubCredentials of(String username, @Nullable String password) {
		return new DockerHubCredentials(true, username, password);
	}

	@Override
	public String toString() {
		return "DockerHubCredentials[authentication=" + authentication + ", username=" + username + ", password="
				+ (password == null ? "null" : "******") + "]";
	}

}
