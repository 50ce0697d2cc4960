package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record InviteRequestType(@JsonProperty("from_user_id") @NotNull Long fromUserId,
        @JsonProperty("to_username") @NotBlank String toUsername) {
}
