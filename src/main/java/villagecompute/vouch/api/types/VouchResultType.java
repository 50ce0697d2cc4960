package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.vouch.data.models.Vouch;
import villagecompute.vouch.services.VouchOutcome;

/**
 * Response for a created vouch.
 *
 * @param vouch
 *            the stored vouch
 * @param pending
 *            true when the target has not joined yet
 * @param mutual
 *            true when the target had already vouched for the author
 * @param rankChange
 *            effect on the target's rank, null for pending vouches
 * @param message
 *            human-readable confirmation
 */
public record VouchResultType(@JsonProperty("vouch") Vouch.VouchSnapshot vouch, @JsonProperty("pending") boolean pending,
        @JsonProperty("mutual") boolean mutual, @JsonProperty("rank_change") RankChangeType rankChange,
        @JsonProperty("message") String message) {

    public static VouchResultType from(VouchOutcome outcome) {
        Vouch vouch = outcome.vouch();
        String message = outcome.pending()
                ? "Vouch recorded for @" + vouch.targetUsername + ". They'll receive it when they join!"
                : "Vouch recorded";
        return new VouchResultType(vouch.toSnapshot(), outcome.pending(), outcome.mutual(),
                RankChangeType.from(outcome.rankChange()), message);
    }
}
