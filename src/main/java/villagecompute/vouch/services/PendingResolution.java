package villagecompute.vouch.services;

import java.util.List;

/**
 * Result of binding pending vouches to a user.
 *
 * @param userId
 *            user the vouches were bound to
 * @param resolvedVouchIds
 *            vouches confirmed by this call, oldest first
 * @param skipped
 *            pending vouches left untouched because confirming them would break the one-vouch-per-pair or no-self-vouch
 *            rules
 * @param rankChange
 *            effect on the user's totals, null when nothing was resolved
 */
public record PendingResolution(Long userId, List<Long> resolvedVouchIds, int skipped, RankChange rankChange) {

    public static PendingResolution none(Long userId) {
        return new PendingResolution(userId, List.of(), 0, null);
    }

    public int resolved() {
        return resolvedVouchIds.size();
    }

    public boolean rankChanged() {
        return rankChange != null && rankChange.changed();
    }
}
