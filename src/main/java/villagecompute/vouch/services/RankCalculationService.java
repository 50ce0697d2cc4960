package villagecompute.vouch.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.vouch.data.models.Rank;

/**
 * Pure rank-ladder arithmetic: maps vouch counts to tiers and reports progress toward the next tier.
 *
 * <p>
 * <b>Ladder:</b>
 * <ul>
 * <li>0-2 vouches → unverified</li>
 * <li>3-5 vouches → verified</li>
 * <li>6-10 vouches → trusted</li>
 * <li>11-15 vouches → endorsed</li>
 * <li>16+ vouches → top_tier</li>
 * </ul>
 *
 * <p>
 * Stateless and side-effect free. Every place that derives a rank from a count must go through
 * {@link #calculate(int)} so the ladder is defined once.
 *
 * @see Rank
 */
@ApplicationScoped
public class RankCalculationService {

    private static final Logger LOG = Logger.getLogger(RankCalculationService.class);

    /**
     * Calculates the tier for a confirmed vouch count.
     *
     * @param vouchCount
     *            confirmed vouches received (negative values are treated as 0)
     * @return highest tier whose threshold is at or below the count
     */
    public Rank calculate(int vouchCount) {
        Rank rank = Rank.forVouchCount(vouchCount);
        LOG.tracef("Rank calculated: vouches=%d, rank=%s", Integer.valueOf(vouchCount), rank.key());
        return rank;
    }

    /**
     * Display name for a stored rank key, {@value Rank#UNKNOWN_NAME} for unrecognized keys.
     */
    public String displayName(String rankKey) {
        return Rank.fromKey(rankKey).map(Rank::displayName).orElse(Rank.UNKNOWN_NAME);
    }

    /**
     * Emoji badge for a stored rank key, {@value Rank#UNKNOWN_EMOJI} for unrecognized keys.
     */
    public String emoji(String rankKey) {
        return Rank.fromKey(rankKey).map(Rank::emoji).orElse(Rank.UNKNOWN_EMOJI);
    }

    /**
     * Returns the vouch count required for the tier after the one the count currently maps to.
     *
     * @param vouchCount
     *            confirmed vouches received
     * @return next threshold (3, 6, 11 or 16), or the count itself once at the top tier
     */
    public int nextThreshold(int vouchCount) {
        return calculate(vouchCount).next().map(Rank::threshold).orElse(Integer.valueOf(vouchCount)).intValue();
    }

    /**
     * Progress from the current tier's threshold toward the next one.
     *
     * <p>
     * For example 4 vouches (verified, 3) heading to trusted (6) is {@code (4 - 3) * 100 / (6 - 3) = 33}. Top-tier
     * users have no next tier and report 0.
     *
     * @param vouchCount
     *            confirmed vouches received
     * @return whole percentage in [0, 100]
     */
    public int progressPercentage(int vouchCount) {
        Rank current = calculate(vouchCount);
        return current.next().map(next -> {
            int span = next.threshold() - current.threshold();
            int progress = (Math.max(vouchCount, 0) - current.threshold()) * 100 / span;
            return Integer.valueOf(Math.max(0, Math.min(100, progress)));
        }).orElse(Integer.valueOf(0)).intValue();
    }
}
