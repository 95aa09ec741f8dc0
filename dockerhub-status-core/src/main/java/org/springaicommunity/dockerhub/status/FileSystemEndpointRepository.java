package org.springaicommunity.dockerhub.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * File system implementation of {@link EndpointRepository}.
 *
 * <p>
 * Reads endpoints from a JSON document of the form:
 *
 * <pre>
 * {@code
 * {
 *   "endpoints": [
 *     { "id": 1, "name": "local", "url": "unix:///var/run/docker.sock", "type": 1 }
 *   ]
 * }
 * }
 * </pre>
 *
 * The file is read on every lookup so edits are picked up without a restart.
 */
public class FileSystemEndpointRepository implements EndpointRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemEndpointRepository.class);

	private final Path endpointsFile;

	private final ObjectMapper objectMapper;

	public FileSystemEndpointRepository(Path endpointsFile, ObjectMapper objectMapper) {
		this.endpointsFile = endpointsFile;
		this.objectMapper = objectMapper;
	}

	@Override
	public EndpointLookup findEndpoint(int endpointId) {
		if (!Files.exists(endpointsFile)) {
			logger.warn("Endpoints file does not exist: {}", endpointsFile);
			return EndpointLookup.failed(new IOException("Endpoints file does not exist: " + endpointsFile));
		}

		@Nullable EndpointsDocument document;
		try {
			document = objectMapper.readValue(endpointsFile.toFile(), EndpointsDocument.class);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.warn("Failed to read endpoints file {}: {}", endpointsFile, e.getMessage());
			return EndpointLookup.failed(e);
		}

		if (document == null) {
			logger.warn("Endpoints file {} holds no document", endpointsFile);
			return EndpointLookup.failed(new IOException("Endpoints file holds no document: " + endpointsFile));
		}

		List<Endpoint> endpoints = document.endpoints() != null ? document.endpoints() : List.of();
		for (Endpoint endpoint : endpoints) {
			if (endpoint == null) {
				logger.warn("Endpoints file {} contains a null entry", endpointsFile);
				return EndpointLookup.failed(new IOException("Endpoints file contains a null entry: " + endpointsFile));
			}
		}
		for (Endpoint endpoint : endpoints) {
			if (endpoint.id() == endpointId) {
				return EndpointLookup.found(endpoint);
			}
		}
		logger.debug("No endpoint with id {} in {}", endpointId, endpointsFile);
		return EndpointLookup.notFound(endpointId);
	}

	record EndpointsDocument(@Nullable List<@Nullable Endpoint> endpoints) {
	}

}
