package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Admin request to correct a user's vouch total.
 *
 * @param delta
 *            change to apply (non-zero, may be negative)
 * @param reason
 *            why the correction is needed
 */
public record AdminVouchAdjustmentType(@JsonProperty("delta") int delta,
        @JsonProperty("reason") @NotBlank String reason) {
}
