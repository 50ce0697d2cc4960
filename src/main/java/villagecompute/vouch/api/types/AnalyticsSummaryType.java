package villagecompute.vouch.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Community-wide rollup for the admin dashboard. Every field is recomputed on each request.
 *
 * @param totalUsers
 *            all users ever seen
 * @param activeUsers
 *            users active in the trailing 24h / 7d / 30d
 * @param newSignups7d
 *            users first seen in the trailing 7 days
 * @param totalVouches
 *            all vouch rows, pending included
 * @param pendingVouches
 *            vouches still waiting for their target to join
 * @param rankDistribution
 *            user count per rank, lowest tier first
 * @param topHelpers
 *            users who gave the most vouches in the trailing 7 days
 * @param mostVouched
 *            users with the highest confirmed vouch totals
 * @param mutualVouchCount
 *            number of mutual vouch events, a proxy for reciprocal trust
 */
public record AnalyticsSummaryType(@JsonProperty("total_users") long totalUsers,
        @JsonProperty("active_users") ActiveUsersType activeUsers, @JsonProperty("new_signups_7d") long newSignups7d,
        @JsonProperty("total_vouches") long totalVouches, @JsonProperty("pending_vouches") long pendingVouches,
        @JsonProperty("rank_distribution") List<RankCountType> rankDistribution,
        @JsonProperty("top_helpers") List<LeaderboardEntryType> topHelpers,
        @JsonProperty("most_vouched") List<LeaderboardEntryType> mostVouched,
        @JsonProperty("mutual_vouch_count") long mutualVouchCount) {
}
