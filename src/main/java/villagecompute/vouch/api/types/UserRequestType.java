package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for registering an interaction from a platform user (get-or-create).
 */
public record UserRequestType(@JsonProperty("user_id") @NotNull Long userId,
        @JsonProperty("username") String username, @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName, @JsonProperty("referrer_id") Long referrerId) {
}
