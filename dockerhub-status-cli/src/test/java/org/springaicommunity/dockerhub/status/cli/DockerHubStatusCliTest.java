package org.springaicommunity.dockerhub.status.cli;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DockerHubStatusCli} against a local server standing in for DockerHub.
 */
@DisplayName("DockerHubStatusCli Tests")
class DockerHubStatusCliTest {

	@TempDir
	Path tempDir;

	private HttpServer server;

	private final ByteArrayOutputStream output = new ByteArrayOutputStream();

	@BeforeEach
	void startServer() throws IOException {
		server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
		server.createContext("/token", exchange -> {
			byte[] body = "{\"token\":\"abc123\"}".getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(200, body.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(body);
			}
		});
		server.createContext("/manifest", exchange -> {
			exchange.getResponseHeaders().add("RateLimit-Limit", "100;w=21600");
			exchange.getResponseHeaders().add("RateLimit-Remaining", "17;w=21600");
			exchange.sendResponseHeaders(200, -1);
			exchange.close();
		});
		server.start();
	}

	@AfterEach
	void stopServer() {
		server.stop(0);
	}

	private String[] fixtureArgs(String... extra) {
		String base = "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
		String[] fixed = { "--anonymous", "--token-url", base + "/token", "--rate-limit-url", base + "/manifest",
				"--timeout", "5" };
		String[] args = new String[fixed.length + extra.length];
		System.arraycopy(fixed, 0, args, 0, fixed.length);
		System.arraycopy(extra, 0, args, fixed.length, extra.length);
		return args;
	}

	private String printed() {
		return output.toString(StandardCharsets.UTF_8).trim();
	}

	@Test
	@DisplayName("Should print help and exit 0")
	void shouldPrintHelp() throws Exception {
		int exitCode = DockerHubStatusCli.run(new String[] { "--help" }, new PrintStream(output, true, "UTF-8"));

		assertThat(exitCode).isZero();
		assertThat(printed()).contains("USAGE:");
	}

	@Test
	@DisplayName("Should print the status as seen from this host")
	void shouldPrintHostStatus() throws Exception {
		int exitCode = DockerHubStatusCli.run(fixtureArgs(), new PrintStream(output, true, "UTF-8"));

		assertThat(exitCode).isZero();
		assertThat(printed()).isEqualTo("{\"remaining\":17,\"limit\":100}");
	}

	@Test
	@DisplayName("Should print the status for a local socket endpoint")
	void shouldPrintEndpointStatus() throws Exception {
		Path endpoints = tempDir.resolve("endpoints.json");
		Files.writeString(endpoints,
				"{\"endpoints\":[{\"id\":1,\"name\":\"local\",\"url\":\"unix:///var/run/docker.sock\",\"type\":1}]}");

		int exitCode = DockerHubStatusCli.run(fixtureArgs("-e", "1", "-f", endpoints.toString()),
				new PrintStream(output, true, "UTF-8"));

		assertThat(exitCode).isZero();
		assertThat(printed()).isEqualTo("{\"remaining\":17,\"limit\":100}");
	}

	@Test
	@DisplayName("Should print an error and exit 1 for a remote endpoint")
	void shouldRejectRemoteEndpoint() throws Exception {
		Path endpoints = tempDir.resolve("endpoints.json");
		Files.writeString(endpoints,
				"{\"endpoints\":[{\"id\":2,\"name\":\"remote\",\"url\":\"tcp://10.0.0.5:2375\",\"type\":1}]}");

		int exitCode = DockerHubStatusCli.run(fixtureArgs("-e", "2", "-f", endpoints.toString()),
				new PrintStream(output, true, "UTF-8"));

		assertThat(exitCode).isEqualTo(1);
		assertThat(printed()).contains("Invalid environment type").doesNotContain("remaining");
	}

	@Test
	@DisplayName("Should print the storage error and exit 1 for a corrupt endpoints file in verbose mode")
	void shouldReportCorruptEndpointsFile() throws Exception {
		Path endpoints = tempDir.resolve("endpoints.json");
		Files.writeString(endpoints, "{\"endpoints\":[null]}");

		int exitCode = DockerHubStatusCli.run(fixtureArgs("-v", "-e", "1", "-f", endpoints.toString()),
				new PrintStream(output, true, "UTF-8"));

		assertThat(exitCode).isEqualTo(1);
		assertThat(printed()).contains("Unable to find an endpoint with the specified identifier inside the database")
			.contains("null entry")
			.doesNotContain("remaining");
	}

	@Test
	@DisplayName("Should exit 1 when DockerHub cannot be reached")
	void shouldFailWhenUnreachable() throws Exception {
		HttpServer stopped = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
		String base = "http://" + stopped.getAddress().getHostString() + ":" + stopped.getAddress().getPort();
		stopped.start();
		stopped.stop(0);

		int exitCode = DockerHubStatusCli.run(new String[] { "--anonymous", "--token-url", base + "/token",
				"--rate-limit-url", base + "/manifest", "--timeout", "2" }, new PrintStream(output, true, "UTF-8"));

		assertThat(exitCode).isEqualTo(1);
		assertThat(printed()).isEmpty();
	}

}
