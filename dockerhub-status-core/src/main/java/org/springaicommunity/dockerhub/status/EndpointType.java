package org.springaicommunity.dockerhub.status;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of managed container environment. Numeric ids match the persisted endpoint
 * documents.
 */
public enum EndpointType {

	DOCKER(1),

	AGENT_ON_DOCKER(2),

	AZURE(3),

	EDGE_AGENT_ON_DOCKER(4),

	KUBERNETES_LOCAL(5),

	AGENT_ON_KUBERNETES(6),

	EDGE_AGENT_ON_KUBERNETES(7);

	private final int id;

	EndpointType(int id) {
		this.id = id;
	}

	@JsonValue
	public int getId() {
		return id;
	}

	/**
	 * Resolve a type from its numeric id.
	 * @param id the persisted type id
	 * @return the matching type
	 * @throws IllegalArgumentException if no type has this id
	 */
	@JsonCreator
	public static EndpointType fromId(int id) {
		for (EndpointType type : values()) {
			if (type.id == id) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown endpoint type: " + id);
	}

}
