package org.springaicommunity.dockerhub.status;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * DockerHub image-pull rate limit status as observed from this server.
 *
 * <p>
 * Serialized as {@code {"remaining": int, "limit": int}}.
 *
 * @param limit the maximum number of pulls allowed per rate-limit window
 * @param remaining the number of pulls left in the current window
 */
@JsonPropertyOrder({ "remaining", "limit" })
public record RateLimitStatus(int limit, int remaining) {

	public RateLimitStatus {
		if (limit < 0) {
			throw new IllegalArgumentException("limit must be non-negative (got: " + limit + ")");
		}
		if (remaining < 0) {
			throw new IllegalArgumentException("remaining must be non-negative (got: " + remaining + ")");
		}
	}

	/**
	 * Returns true if no pulls are left in the current window.
	 * @return true if the quota is used up
	 */
	@JsonIgnore
	public boolean isExceeded() {
		return remaining == 0;
	}

}
