package villagecompute.vouch.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.vouch.api.types.ActiveUsersType;
import villagecompute.vouch.api.types.AnalyticsSummaryType;
import villagecompute.vouch.api.types.GrowthSummaryType;
import villagecompute.vouch.api.types.LeaderboardEntryType;
import villagecompute.vouch.api.types.LeaderboardType;
import villagecompute.vouch.api.types.RankCountType;
import villagecompute.vouch.api.types.ReferralStatsType;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.data.models.Rank;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.data.models.Vouch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only rollups over users, vouches and events.
 *
 * <p>
 * Windows are relative to the wall clock at query time and nothing is cached; every call recomputes. Leaderboard ties
 * fall back to insertion order (first seen for users, lowest vouch id for helpers).
 */
@ApplicationScoped
public class AnalyticsService {

    private static final Logger LOG = Logger.getLogger(AnalyticsService.class);

    private static final int RECENT_REFERRALS = 10;
    private static final int RECENT_ACTIVITY = 10;

    @Inject
    EntityManager entityManager;

    @Inject
    RankCalculationService rankCalculator;

    @ConfigProperty(
            name = "vouch.analytics.leaderboard-size",
            defaultValue = "10")
    int leaderboardSize;

    /**
     * Computes the full dashboard summary.
     */
    @Transactional
    public AnalyticsSummaryType summary() {
        Instant now = Instant.now();

        ActiveUsersType activeUsers = new ActiveUsersType(User.countActiveSince(now.minus(Duration.ofHours(24))),
                User.countActiveSince(now.minus(Duration.ofDays(7))),
                User.countActiveSince(now.minus(Duration.ofDays(30))));

        AnalyticsSummaryType summary = new AnalyticsSummaryType(User.count(), activeUsers,
                User.countFirstSeenSince(now.minus(Duration.ofDays(7))), Vouch.count(), Vouch.countPending(),
                rankDistribution(),
                topHelpers(now.minus(Duration.ofDays(7)), leaderboardSize), mostVouched(leaderboardSize),
                DomainEvent.countByType(DomainEvent.TYPE_MUTUAL_VOUCH));

        LOG.debugf("Analytics summary computed: %d users, %d vouches", summary.totalUsers(), summary.totalVouches());
        return summary;
    }

    /**
     * Most vouched users and top helpers of the last 7 days.
     */
    @Transactional
    public LeaderboardType leaderboard() {
        return new LeaderboardType(mostVouched(leaderboardSize),
                topHelpers(Instant.now().minus(Duration.ofDays(7)), leaderboardSize));
    }

    /**
     * Number of users at each rank, lowest tier first. Tiers with no users are reported with a zero count; stored keys
     * that match no tier are appended with the unknown sentinel.
     */
    @Transactional
    public List<RankCountType> rankDistribution() {
        List<Object[]> rows = entityManager
                .createQuery("SELECT u.currentRank, COUNT(u) FROM User u GROUP BY u.currentRank", Object[].class)
                .getResultList();

        Map<String, Long> counts = new HashMap<>();
        for (Object[] row : rows) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }

        List<RankCountType> distribution = new ArrayList<>();
        for (Rank rank : Rank.values()) {
            Long count = counts.remove(rank.key());
            distribution.add(new RankCountType(rank.key(), rank.displayName(), rank.emoji(),
                    count == null ? 0L : count.longValue()));
        }
        counts.forEach((key, count) -> distribution
                .add(new RankCountType(key, rankCalculator.displayName(key), rankCalculator.emoji(key),
                        count.longValue())));
        return distribution;
    }

    /**
     * Users who gave the most vouches since the given instant.
     */
    @Transactional
    public List<LeaderboardEntryType> topHelpers(Instant since, int limit) {
        List<Object[]> rows = entityManager.createQuery("""
                SELECT u.id, u.username, u.firstName, u.currentRank, COUNT(v.id)
                FROM Vouch v, User u
                WHERE u.id = v.sourceUserId AND v.createdAt > :since
                GROUP BY u.id, u.username, u.firstName, u.currentRank
                ORDER BY COUNT(v.id) DESC, MIN(v.id) ASC
                """, Object[].class).setParameter("since", since).setMaxResults(limit).getResultList();

        List<LeaderboardEntryType> helpers = new ArrayList<>();
        for (Object[] row : rows) {
            helpers.add(entry((Long) row[0], (String) row[1], (String) row[2], (String) row[3],
                    ((Number) row[4]).longValue()));
        }
        return helpers;
    }

    /**
     * Users with the highest confirmed vouch totals.
     */
    @Transactional
    public List<LeaderboardEntryType> mostVouched(int limit) {
        return User.listByVouches(0, limit).stream()
                .map(user -> entry(user.id, user.username, user.firstName, user.currentRank, user.totalVouches))
                .toList();
    }

    /**
     * Vouches created in the last 24 hours, referred signups and the latest confirmed vouches.
     */
    @Transactional
    public GrowthSummaryType growthSummary() {
        return new GrowthSummaryType(Vouch.countCreatedSince(Instant.now().minus(Duration.ofHours(24))),
                User.countReferred(),
                Vouch.findRecentConfirmed(RECENT_ACTIVITY).stream().map(Vouch::toSnapshot).toList());
    }

    /**
     * How many users a member referred, and the most recent of them.
     */
    @Transactional
    public ReferralStatsType referralStats(Long userId) {
        return new ReferralStatsType(userId, User.countReferredBy(userId),
                User.findRecentlyReferredBy(userId, RECENT_REFERRALS).stream().map(User::toSnapshot).toList());
    }

    private LeaderboardEntryType entry(Long userId, String username, String firstName, String rankKey, long count) {
        return new LeaderboardEntryType(userId, username, firstName, count, rankKey, rankCalculator.displayName(rankKey),
                rankCalculator.emoji(rankKey));
    }
}
