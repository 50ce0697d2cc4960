package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Users active within trailing windows, by last-active timestamp.
 */
public record ActiveUsersType(@JsonProperty("24h") long last24Hours, @JsonProperty("7d") long last7Days,
        @JsonProperty("30d") long last30Days) {
}
