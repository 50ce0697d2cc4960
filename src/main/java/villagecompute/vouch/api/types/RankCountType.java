package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Number of users at one rank.
 */
public record RankCountType(@JsonProperty("rank") String rank, @JsonProperty("rank_name") String rankName,
        @JsonProperty("rank_emoji") String rankEmoji, @JsonProperty("count") long count) {
}
