package org.springaicommunity.dockerhub.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link RegistryTransport} backed by the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Bodies are always read to completion with {@link HttpResponse.BodyHandlers#ofString()},
 * which returns the connection to the pool on every status.
 */
public class JdkRegistryTransport implements RegistryTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkRegistryTransport.class);

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	private final String userAgent;

	public JdkRegistryTransport(DockerHubProperties properties) {
		this(HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), Duration.ofSeconds(properties.getRequestTimeoutSeconds()), properties.getUserAgent());
	}

	public JdkRegistryTransport(HttpClient httpClient, Duration requestTimeout, String userAgent) {
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
		this.userAgent = userAgent;
	}

	@Override
	public RegistryResponse execute(RegistryRequest request) {
		logger.debug("{} {}", request.method(), request.uri());
		long start = System.currentTimeMillis();

		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(request.uri())
			.timeout(requestTimeout)
			.header("User-Agent", userAgent)
			.method(request.method(), HttpRequest.BodyPublishers.noBody());
		request.headers().forEach(builder::header);

		try {
			HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
			logger.debug("{} {} completed in {}ms (status {})", request.method(), request.uri(),
					System.currentTimeMillis() - start, response.statusCode());
			return new RegistryResponse(response.statusCode(), response.headers(), response.body());
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", request.method(), request.uri(),
					System.currentTimeMillis() - start, e.getMessage());
			throw new DockerHubApiException(DockerHubApiException.Reason.TRANSPORT,
					"HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new DockerHubApiException(DockerHubApiException.Reason.TRANSPORT, "HTTP request interrupted", e);
		}
	}

}
