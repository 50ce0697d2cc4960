package villagecompute.vouch.util;

import java.util.Locale;

/**
 * Canonical form for platform usernames.
 *
 * <p>
 * Usernames arrive as typed by people: with or without a leading {@code @}, in any case, sometimes padded with
 * whitespace. Every username comparison in the service (pending vouch lookup, resolution on sign-up, invite cooldown)
 * goes through {@link #normalize(String)} so that {@code "@Bob"}, {@code "bob"} and {@code " BOB "} all match.
 */
public final class UsernameNormalizer {

    private UsernameNormalizer() {
        // Utility class
    }

    /**
     * Strips surrounding whitespace and leading {@code @} characters, then lowercases.
     *
     * @param username
     *            raw username, may be null
     * @return normalized username, or null when nothing meaningful remains
     */
    public static String normalize(String username) {
        if (username == null) {
            return null;
        }

        String candidate = username.trim();
        int start = 0;
        while (start < candidate.length() && candidate.charAt(start) == '@') {
            start++;
        }
        candidate = candidate.substring(start).trim();

        if (candidate.isEmpty()) {
            return null;
        }
        return candidate.toLowerCase(Locale.ROOT);
    }
}
