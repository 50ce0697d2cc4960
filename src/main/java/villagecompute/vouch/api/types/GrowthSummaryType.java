package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.vouch.data.models.Vouch;

import java.util.List;

public record GrowthSummaryType(@JsonProperty("vouches_today") long vouchesToday,
        @JsonProperty("referral_signups") long referralSignups,
        @JsonProperty("recent_activity") List<Vouch.VouchSnapshot> recentActivity) {
}
