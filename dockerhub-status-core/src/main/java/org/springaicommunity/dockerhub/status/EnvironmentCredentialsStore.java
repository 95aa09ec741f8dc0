package org.springaicommunity.dockerhub.status;

import org.jspecify.annotations.Nullable;

import java.util.function.Function;

/**
 * Reads DockerHub credentials from {@code DOCKERHUB_USERNAME} and
 * {@code DOCKERHUB_PASSWORD}.
 *
 * <p>
 * Authentication is enabled when a username is set; otherwise tokens are requested
 * anonymously.
 */
public class EnvironmentCredentialsStore implements DockerHubCredentialsStore {

	public static final String USERNAME_VARIABLE = "DOCKERHUB_USERNAME";

	public static final String PASSWORD_VARIABLE = "DOCKERHUB_PASSWORD";

	private final Function<String, @Nullable String> environment;

	public EnvironmentCredentialsStore() {
		this(EnvironmentSupport::get);
	}

	public EnvironmentCredentialsStore(Function<String, @Nullable String> environment) {
		this.environment = environment;
	}

	@Override
	public DockerHubCredentials getCredentials() {
		String username = environment.apply(USERNAME_VARIABLE);
		if (username == null || username.isBlank()) {
			return DockerHubCredentials.anonymous();
		}
		return DockerHubCredentials.of(username, environment.apply(PASSWORD_VARIABLE));
	}

}
