package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for creating a vouch. Exactly one of {@code to_user_id} and {@code to_username} is needed; when both
 * are given the id wins.
 *
 * @param fromUserId
 *            user giving the vouch
 * @param toUserId
 *            receiving user's platform id (optional)
 * @param toUsername
 *            receiving user's username, {@code @} optional (optional)
 * @param message
 *            free text, redacted and truncated to 120 characters (optional)
 */
public record CreateVouchRequestType(@JsonProperty("from_user_id") @NotNull Long fromUserId,
        @JsonProperty("to_user_id") Long toUserId, @JsonProperty("to_username") String toUsername,
        @JsonProperty("message") String message) {
}
