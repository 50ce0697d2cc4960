package villagecompute.vouch.data.models;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered reputation tiers derived from a user's confirmed vouch count.
 *
 * <p>
 * Each tier carries a stable storage key (persisted in {@code users.current_rank} and in rank history), a display
 * name, an emoji badge and the minimum vouch count required to reach it. Declaration order is ascending by threshold.
 *
 * <table>
 * <tr>
 * <th>Key</th>
 * <th>Display</th>
 * <th>Threshold</th>
 * </tr>
 * <tr>
 * <td>unverified</td>
 * <td>Unverified 🚫</td>
 * <td>0</td>
 * </tr>
 * <tr>
 * <td>verified</td>
 * <td>Verified ✅</td>
 * <td>3</td>
 * </tr>
 * <tr>
 * <td>trusted</td>
 * <td>Trusted 🔷</td>
 * <td>6</td>
 * </tr>
 * <tr>
 * <td>endorsed</td>
 * <td>Endorsed 🛡</td>
 * <td>11</td>
 * </tr>
 * <tr>
 * <td>top_tier</td>
 * <td>Top-Tier Verified 👑</td>
 * <td>16</td>
 * </tr>
 * </table>
 */
public enum Rank {

    UNVERIFIED("unverified", "Unverified", "🚫", 0),
    VERIFIED("verified", "Verified", "✅", 3),
    TRUSTED("trusted", "Trusted", "🔷", 6),
    ENDORSED("endorsed", "Endorsed", "🛡", 11),
    TOP_TIER("top_tier", "Top-Tier Verified", "👑", 16);

    /** Display name reported for keys that match no tier. */
    public static final String UNKNOWN_NAME = "Unknown";

    /** Emoji reported for keys that match no tier. */
    public static final String UNKNOWN_EMOJI = "❓";

    private final String key;
    private final String displayName;
    private final String emoji;
    private final int threshold;

    Rank(String key, String displayName, String emoji, int threshold) {
        this.key = key;
        this.displayName = displayName;
        this.emoji = emoji;
        this.threshold = threshold;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public String emoji() {
        return emoji;
    }

    public int threshold() {
        return threshold;
    }

    /**
     * Returns the next tier up, or empty at the top of the ladder.
     */
    public Optional<Rank> next() {
        Rank[] ranks = values();
        int nextOrdinal = ordinal() + 1;
        return nextOrdinal < ranks.length ? Optional.of(ranks[nextOrdinal]) : Optional.empty();
    }

    /**
     * Resolves a stored rank key. Matching is exact after trimming and lowercasing.
     *
     * @param key
     *            stored key such as {@code "trusted"}
     * @return the tier, or empty when the key is null or unrecognized
     */
    public static Optional<Rank> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String candidate = key.trim().toLowerCase(Locale.ROOT);
        for (Rank rank : values()) {
            if (rank.key.equals(candidate)) {
                return Optional.of(rank);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the highest tier whose threshold does not exceed the given count. Negative counts map to the lowest tier.
     */
    public static Rank forVouchCount(int vouchCount) {
        Rank result = UNVERIFIED;
        for (Rank rank : values()) {
            if (vouchCount >= rank.threshold) {
                result = rank;
            }
        }
        return result;
    }
}
