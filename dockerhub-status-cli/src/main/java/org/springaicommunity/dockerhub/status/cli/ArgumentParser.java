package org.springaicommunity.dockerhub.status.cli;

import org.springaicommunity.dockerhub.status.DockerHubProperties;
import org.springaicommunity.dockerhub.status.EnvironmentCredentialsStore;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the DockerHub status tool.
 */
public class ArgumentParser {

	private final DockerHubProperties defaultProperties;

	public ArgumentParser(DockerHubProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-e", "--endpoint-id":
					String endpointIdStr = getRequiredValue(args, i, "endpoint-id");
					try {
						config.endpointId = Integer.parseInt(endpointIdStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid endpoint id '" + endpointIdStr + "': must be a positive integer");
					}
					i++;
					break;

				case "-f", "--endpoints-file":
					config.endpointsFile = getRequiredValue(args, i, "endpoints-file");
					i++;
					break;

				case "--anonymous":
					config.anonymous = true;
					break;

				case "--token-url":
					config.tokenUrl = getRequiredValue(args, i, "token-url");
					i++;
					break;

				case "--rate-limit-url":
					config.rateLimitUrl = getRequiredValue(args, i, "rate-limit-url");
					i++;
					break;

				case "-t", "--timeout":
					String timeoutStr = getRequiredValue(args, i, "timeout");
					try {
						config.timeoutSeconds = Integer.parseInt(timeoutStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid timeout '" + timeoutStr + "': must be a positive number of seconds");
					}
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					// answered by isHelpRequested before parsing
					break;

				default:
					throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}

		validateConfiguration(config);
		return config;
	}

	/**
	 * Check if help was requested without parsing other arguments.
	 * @param args Command-line arguments
	 * @return true if help was requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("DockerHub Status - Show the DockerHub pull rate limit as seen from this host\n");
		help.append("\n");
		help.append("USAGE:\n");
		help.append("    dockerhub-status [OPTIONS]\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -e, --endpoint-id <id>      Endpoint to check (requires --endpoints-file)\n");
		help.append("    -f, --endpoints-file <file> JSON file with the managed endpoints\n");
		help.append("        --anonymous             Request the token without credentials\n");
		help.append("        --token-url <url>       Auth service URL (default: DockerHub)\n");
		help.append("        --rate-limit-url <url>  Manifest URL probed for rate limits (default: DockerHub)\n");
		help.append("    -t, --timeout <seconds>     Connect and request timeout (default: ")
			.append(defaultProperties.getRequestTimeoutSeconds())
			.append(")\n");
		help.append("    -v, --verbose               Log the failure details and stack trace\n");
		help.append("    -h, --help                  Show this help message\n");
		help.append("\n");
		help.append("ENVIRONMENT:\n");
		help.append("    ")
			.append(EnvironmentCredentialsStore.USERNAME_VARIABLE)
			.append("      DockerHub username (anonymous when unset)\n");
		help.append("    ")
			.append(EnvironmentCredentialsStore.PASSWORD_VARIABLE)
			.append("      DockerHub password or personal access token\n");
		help.append("    Both are also read from a .env file in the working or home directory.\n");
		help.append("\n");
		help.append("OUTPUT:\n");
		help.append("    {\"remaining\":<int>,\"limit\":<int>}\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    dockerhub-status\n");
		help.append("    dockerhub-status --anonymous --timeout 10\n");
		help.append("    dockerhub-status --endpoint-id 1 --endpoints-file endpoints.json\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.endpointId != null && config.endpointId <= 0) {
			errors.add("Endpoint id must be positive (got: " + config.endpointId + ")");
		}
		if (config.endpointId != null && config.endpointsFile == null) {
			errors.add("--endpoint-id requires --endpoints-file");
		}
		if (config.endpointsFile != null && config.endpointId == null) {
			errors.add("--endpoints-file requires --endpoint-id");
		}

		if (config.timeoutSeconds <= 0) {
			errors.add("Timeout must be positive (got: " + config.timeoutSeconds + ")");
		}

		validateUrl("token URL", config.tokenUrl, errors);
		validateUrl("rate limit URL", config.rateLimitUrl, errors);

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private static void validateUrl(String label, String url, List<String> errors) {
		try {
			URI uri = new URI(url);
			if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
				errors.add("Invalid " + label + ": " + url + " (must be http or https)");
			}
		}
		catch (URISyntaxException e) {
			errors.add("Invalid " + label + ": " + url);
		}
	}

}
