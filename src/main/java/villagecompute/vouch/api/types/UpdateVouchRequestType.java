package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * Request body for editing a vouch message. Only the vouch's author may edit it.
 */
public record UpdateVouchRequestType(@JsonProperty("user_id") @NotNull Long userId,
        @JsonProperty("message") @NotNull String message) {
}
