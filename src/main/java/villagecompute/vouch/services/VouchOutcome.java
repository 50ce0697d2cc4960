package villagecompute.vouch.services;

import villagecompute.vouch.data.models.Vouch;

/**
 * Result of a successful {@code createVouch}.
 *
 * @param vouch
 *            persisted vouch, pending or confirmed
 * @param rankChange
 *            effect on the target's totals, null for pending vouches
 * @param mutual
 *            true when the target had already vouched for the source
 */
public record VouchOutcome(Vouch vouch, RankChange rankChange, boolean mutual) {

    public boolean pending() {
        return vouch.isPending;
    }

    public boolean rankChanged() {
        return rankChange != null && rankChange.changed();
    }
}
