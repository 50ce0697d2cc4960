package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Admin request to set a user's rank directly.
 *
 * @param rank
 *            target rank key, e.g. {@code "trusted"}
 * @param reason
 *            why the correction is needed
 */
public record AdminRankChangeType(@JsonProperty("rank") @NotBlank String rank, @JsonProperty("reason") String reason) {
}
