package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.data.models.Vouch;

import java.util.List;

/**
 * Full profile view: the user, their vouches in both directions and progress toward the next rank.
 *
 * @param nextRankThreshold
 *            vouches needed for the next tier, or the current total at the top tier
 * @param progressPercentage
 *            0-100 progress through the current tier, 0 at the top tier
 */
public record ProfileType(@JsonProperty("user") User.UserSnapshot user,
        @JsonProperty("vouches_received") List<Vouch.VouchSnapshot> vouchesReceived,
        @JsonProperty("vouches_given") List<Vouch.VouchSnapshot> vouchesGiven,
        @JsonProperty("next_rank_threshold") int nextRankThreshold,
        @JsonProperty("progress_percentage") int progressPercentage) {
}
