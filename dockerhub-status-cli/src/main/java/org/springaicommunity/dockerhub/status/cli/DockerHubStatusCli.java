package org.springaicommunity.dockerhub.status.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.dockerhub.status.*;

import java.io.PrintStream;
import java.nio.file.Paths;

/**
 * DockerHub Status CLI Application
 *
 * Plain Java command-line application printing the DockerHub pull rate limit as seen from
 * this host, or for one managed endpoint read from an endpoints file.
 *
 * Usage: java -jar dockerhub-status-cli.jar [OPTIONS]
 *
 * Environment Variables: DOCKERHUB_USERNAME, DOCKERHUB_PASSWORD - optional DockerHub
 * credentials for authenticated limits
 *
 * Examples: java -jar dockerhub-status-cli.jar java -jar dockerhub-status-cli.jar
 * --anonymous java -jar dockerhub-status-cli.jar --endpoint-id 1 --endpoints-file
 * endpoints.json
 */
public class DockerHubStatusCli {

	private static final Logger logger = LoggerFactory.getLogger(DockerHubStatusCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args, System.out);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("DockerHub status check failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args, PrintStream out) throws Exception {
		ArgumentParser argumentParser = new ArgumentParser(new DockerHubProperties());

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		logConfiguration(config);

		ObjectMapper mapper = ObjectMapperFactory.create();
		DockerHubCredentialsStore credentialsStore = config.anonymous ? DockerHubCredentials::anonymous
				: new EnvironmentCredentialsStore();
		DockerHubStatusBuilder builder = DockerHubStatusBuilder.create()
			.properties(config.toProperties())
			.objectMapper(mapper);

		@Nullable DockerHubStatusHandler handler = config.isEndpointMode() ? builder.buildHandler(
				new FileSystemEndpointRepository(Paths.get(config.endpointsFile), mapper), credentialsStore) : null;

		try {
			RateLimitStatus status = handler != null ? handler.getStatus(config.endpointId)
					: builder.buildStatusService().getStatus(credentialsStore.getCredentials());
			out.println(mapper.writeValueAsString(status));
			if (status.isExceeded()) {
				logger.warn("DockerHub pull rate limit exhausted: 0/{} remaining", status.limit());
			}
			return 0;
		}
		catch (DockerHubStatusException e) {
			if (handler != null) {
				out.println(handler.errorResponse(e).body());
			}
			Throwable cause = e.getCause();
			logger.error("{}: {}", e.getMessage(), cause != null ? cause.getMessage() : e.getKind());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Endpoint: {}", config.endpointId != null ? config.endpointId : "(this host)");
		if (config.endpointsFile != null) {
			logger.info("  Endpoints file: {}", config.endpointsFile);
		}
		logger.info("  Anonymous: {}", config.anonymous);
		logger.info("  Token URL: {}", config.tokenUrl);
		logger.info("  Rate limit URL: {}", config.rateLimitUrl);
		logger.info("  Timeout: {}s", config.timeoutSeconds);
	}

}
