package villagecompute.vouch.services;

import villagecompute.vouch.data.models.Rank;

/**
 * Result of applying a vouch-count delta to a user: totals and ranks before and after.
 *
 * <p>
 * Callers use {@link #changed()} to decide on rank-up notifications instead of inspecting rank history.
 *
 * @param userId
 *            user whose count changed
 * @param oldTotal
 *            vouch count before the change
 * @param newTotal
 *            vouch count after the change
 * @param oldRank
 *            rank before the change, null if the stored key was unrecognized
 * @param newRank
 *            rank calculated from {@code newTotal}
 */
public record RankChange(Long userId, int oldTotal, int newTotal, Rank oldRank, Rank newRank) {

    public boolean changed() {
        return oldRank != newRank;
    }

    /**
     * True when the new rank is above the old one.
     */
    public boolean promoted() {
        return changed() && (oldRank == null || newRank.compareTo(oldRank) > 0);
    }
}
