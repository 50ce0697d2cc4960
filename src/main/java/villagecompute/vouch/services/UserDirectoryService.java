package villagecompute.vouch.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.data.models.Rank;
import villagecompute.vouch.data.models.RankEvent;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.data.models.UsernameLock;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.util.UsernameNormalizer;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static villagecompute.vouch.services.EventLogService.metadata;

/**
 * UserDirectoryService owns user records: first-contact creation, activity tracking, usernames and profile fields.
 *
 * <p>
 * Vouch totals and ranks are never written here directly; they go through {@link VouchLedgerService}.
 *
 * <p>
 * <b>First contact:</b> {@link #getOrCreate} inserts with {@code ON CONFLICT DO NOTHING} so simultaneous first
 * requests from the same platform identity create exactly one row and one {@code user_signup} event.
 */
@ApplicationScoped
public class UserDirectoryService {

    private static final Logger LOG = Logger.getLogger(UserDirectoryService.class);

    @Inject
    VouchLedgerService ledger;

    @Inject
    EventLogService eventLog;

    @ConfigProperty(
            name = "vouch.profile.bio-max-length",
            defaultValue = "500")
    int bioMaxLength;

    @ConfigProperty(
            name = "vouch.profile.location-max-length",
            defaultValue = "100")
    int locationMaxLength;

    /**
     * Returns the user for a platform identity, creating it on first contact.
     *
     * <p>
     * <b>Existing user:</b> refreshes last-active and the streak. If a username is supplied and differs from the
     * stored one it is replaced and pending vouches for the new name are resolved. A blank username is ignored.
     *
     * <p>
     * <b>New user:</b> inserts with zero vouches and the lowest rank, records {@code user_signup} (and
     * {@code referral_signup} when referred), then resolves pending vouches for the supplied username.
     *
     * @param userId
     *            platform-assigned id
     * @param username
     *            current platform username (optional)
     * @param firstName
     *            first name, only stored on creation (optional)
     * @param lastName
     *            last name, only stored on creation (optional)
     * @param referrerId
     *            referring user, only stored on creation (optional)
     * @return the created or refreshed user
     */
    @Transactional
    public User getOrCreate(Long userId, String username, String firstName, String lastName, Long referrerId) {
        if (userId == null) {
            throw new InvalidRequestException("User id is required");
        }

        Long effectiveReferrer = referrerId != null && !referrerId.equals(userId) ? referrerId : null;
        Instant now = Instant.now();

        String normalizedUsername = UsernameNormalizer.normalize(username);
        String claimedUsername = normalizedUsername != null ? username : null;
        if (normalizedUsername != null) {
            UsernameLock.acquire(normalizedUsername);
        }

        int inserted = User.insertIfAbsent(userId, claimedUsername, firstName, lastName, effectiveReferrer, now);
        User user = User.findByIdForUpdate(userId);

        if (inserted == 1) {
            eventLog.log(DomainEvent.TYPE_USER_SIGNUP, userId,
                    metadata("referrer_id", effectiveReferrer, "username", claimedUsername));
            if (effectiveReferrer != null) {
                eventLog.log(DomainEvent.TYPE_REFERRAL_SIGNUP, effectiveReferrer, metadata("referred_user", userId));
            }
            LOG.infof("New user %d signed up (username=%s, referrer=%s)", userId, claimedUsername, effectiveReferrer);

            if (claimedUsername != null) {
                ledger.resolvePendingVouches(userId, claimedUsername);
            }
            return user;
        }

        user.recordActivity(now);
        if (claimedUsername != null && !claimedUsername.equals(user.username)) {
            String previous = user.username;
            user.username = claimedUsername;
            LOG.infof("User %d changed username from %s to %s", userId, previous, claimedUsername);
            ledger.resolvePendingVouches(userId, claimedUsername);
        }
        return user;
    }

    /**
     * Looks up a user. Absence is not an error; callers treat it as "needs onboarding".
     */
    @Transactional
    public Optional<User> get(Long userId) {
        return User.findByIdOptional(userId);
    }

    /**
     * Sets a user's rank directly and records the transition unconditionally.
     *
     * <p>
     * This is the administrative correction entry point. Ordinary vouch activity recomputes ranks inside the ledger
     * and never comes through here.
     *
     * @param rankKey
     *            one of the {@link Rank} keys
     * @throws InvalidRequestException
     *             if the key is not a known rank
     * @throws ResourceNotFoundException
     *             if the user does not exist
     */
    @Transactional
    public User updateRank(Long userId, String rankKey) {
        Rank rank = Rank.fromKey(rankKey)
                .orElseThrow(() -> new InvalidRequestException("Unknown rank: " + rankKey));

        User user = User.findByIdForUpdate(userId);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }

        ledger.recordRankTransition(user, rank, RankEvent.TRIGGER_ADMIN_RANK_CHANGE);
        return user;
    }

    /**
     * Updates self-managed profile fields. Null arguments leave the field unchanged; bio and location are truncated.
     *
     * @throws InvalidRequestException
     *             if every field is null
     * @throws ResourceNotFoundException
     *             if the user does not exist
     */
    @Transactional
    public User updateProfile(Long userId, String bio, String location, String profilePictureUrl) {
        if (bio == null && location == null && profilePictureUrl == null) {
            throw new InvalidRequestException("No fields to update");
        }

        User user = User.findByIdForUpdate(userId);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }

        if (bio != null) {
            user.bio = truncate(bio, bioMaxLength);
        }
        if (location != null) {
            user.location = truncate(location, locationMaxLength);
        }
        if (profilePictureUrl != null) {
            user.profilePictureUrl = profilePictureUrl;
        }

        eventLog.log(DomainEvent.TYPE_PROFILE_UPDATED, userId,
                metadata("bio", bio != null, "location", location != null, "profile_picture_url",
                        profilePictureUrl != null));
        LOG.debugf("Profile updated for user %d", userId);
        return user;
    }

    /**
     * Rank transitions for a user, most recent first.
     *
     * @throws ResourceNotFoundException
     *             if the user does not exist
     */
    @Transactional
    public List<RankEvent> rankHistory(Long userId) {
        if (User.findById(userId) == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }
        return RankEvent.findByUserId(userId);
    }

    @Transactional
    public List<User> listUsers(int limit, int offset) {
        return User.listByVouches(Math.max(0, offset), Math.max(1, limit));
    }

    /**
     * Case-insensitive search on username and names. A blank query returns nothing.
     */
    @Transactional
    public List<User> searchUsers(String query, int limit) {
        String term = Objects.requireNonNullElse(query, "").trim();
        if (term.startsWith("@")) {
            term = term.substring(1);
        }
        if (term.isEmpty()) {
            return List.of();
        }
        return User.search(term, Math.max(1, limit));
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
