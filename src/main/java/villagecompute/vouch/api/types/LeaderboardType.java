package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LeaderboardType(@JsonProperty("most_vouched") List<LeaderboardEntryType> mostVouched,
        @JsonProperty("top_helpers") List<LeaderboardEntryType> topHelpers) {
}
