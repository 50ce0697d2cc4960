package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.vouch.data.models.Rank;
import villagecompute.vouch.services.RankChange;

/**
 * Rank effect of a vouch-count change, as returned to clients.
 */
public record RankChangeType(@JsonProperty("user_id") Long userId, @JsonProperty("old_total") int oldTotal,
        @JsonProperty("new_total") int newTotal, @JsonProperty("old_rank") String oldRank,
        @JsonProperty("new_rank") String newRank, @JsonProperty("new_rank_name") String newRankName,
        @JsonProperty("new_rank_emoji") String newRankEmoji, @JsonProperty("rank_changed") boolean rankChanged) {

    public static RankChangeType from(RankChange change) {
        if (change == null) {
            return null;
        }
        Rank newRank = change.newRank();
        return new RankChangeType(change.userId(), change.oldTotal(), change.newTotal(),
                change.oldRank() == null ? null : change.oldRank().key(), newRank.key(), newRank.displayName(),
                newRank.emoji(), change.changed());
    }
}
