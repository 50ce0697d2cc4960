package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One leaderboard row.
 *
 * @param count
 *            vouches received (most vouched) or given in the trailing window (top helpers)
 */
public record LeaderboardEntryType(@JsonProperty("user_id") Long userId, @JsonProperty("username") String username,
        @JsonProperty("first_name") String firstName, @JsonProperty("count") long count,
        @JsonProperty("rank") String rank, @JsonProperty("rank_name") String rankName,
        @JsonProperty("rank_emoji") String rankEmoji) {
}
