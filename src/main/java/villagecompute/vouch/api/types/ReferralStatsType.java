package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.vouch.data.models.User;

import java.util.List;

public record ReferralStatsType(@JsonProperty("user_id") Long userId, @JsonProperty("referral_count") long referralCount,
        @JsonProperty("recent_referrals") List<User.UserSnapshot> recentReferrals) {
}
