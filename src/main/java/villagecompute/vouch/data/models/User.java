package villagecompute.vouch.data.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.LockModeType;
import jakarta.persistence.Table;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * User entity implementing the Panache ActiveRecord pattern for platform members.
 *
 * <p>
 * Users are keyed by the id the chat platform assigns them; the service never generates user ids. A row is created on
 * first interaction and never deleted.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGINT, PK) - Platform-assigned identity</li>
 * <li>{@code username} (TEXT) - Display username, case preserved, matched case-insensitively</li>
 * <li>{@code first_name}, {@code last_name} (TEXT) - Names as reported by the platform</li>
 * <li>{@code bio}, {@code location}, {@code profile_picture_url} (TEXT) - Self-managed profile fields</li>
 * <li>{@code first_seen_at} (TIMESTAMPTZ) - First interaction, immutable</li>
 * <li>{@code last_active_at} (TIMESTAMPTZ) - Most recent interaction</li>
 * <li>{@code total_vouches} (INT) - Confirmed vouches received</li>
 * <li>{@code current_rank} (TEXT) - Rank key, always equal to the rank calculated from {@code total_vouches}</li>
 * <li>{@code referrer_id} (BIGINT) - User who referred this one, immutable</li>
 * <li>{@code streak_days} (INT), {@code last_streak_date} (DATE) - Consecutive UTC days of activity</li>
 * </ul>
 *
 * <p>
 * {@code totalVouches} and {@code currentRank} are written only by the vouch ledger.
 *
 * @see Vouch
 * @see Rank
 */
@Entity
@Table(
        name = "users")
public class User extends PanacheEntityBase {

    private static final String INSERT_IF_ABSENT_SQL = """
            INSERT INTO users (id, username, first_name, last_name, first_seen_at, last_active_at, total_vouches,
                               current_rank, referrer_id, streak_days, last_streak_date)
            VALUES (:id, :username, :firstName, :lastName, :now, :now, 0, :rank, :referrerId, 1, :today)
            ON CONFLICT DO NOTHING
            """;

    @Id
    @Column(
            nullable = false)
    public Long id;

    @Column
    public String username;

    @Column(
            name = "first_name")
    public String firstName;

    @Column(
            name = "last_name")
    public String lastName;

    @Column
    public String bio;

    @Column(
            name = "profile_picture_url")
    public String profilePictureUrl;

    @Column
    public String location;

    @Column(
            name = "first_seen_at",
            nullable = false,
            updatable = false)
    public Instant firstSeenAt;

    @Column(
            name = "last_active_at",
            nullable = false)
    public Instant lastActiveAt;

    @Column(
            name = "total_vouches",
            nullable = false)
    public int totalVouches;

    @Column(
            name = "current_rank",
            nullable = false)
    public String currentRank;

    @Column(
            name = "referrer_id",
            updatable = false)
    public Long referrerId;

    @Column(
            name = "streak_days",
            nullable = false)
    public int streakDays;

    @Column(
            name = "last_streak_date")
    public LocalDate lastStreakDate;

    /**
     * Inserts a fresh user row unless one already exists for the id.
     *
     * <p>
     * Concurrent first contact from the same identity is resolved by the primary key: exactly one caller sees 1, the
     * others see 0 and fall through to the existing-user path.
     *
     * @return number of rows inserted (1 when created, 0 when the id already existed)
     */
    public static int insertIfAbsent(Long id, String username, String firstName, String lastName, Long referrerId,
            Instant now) {
        return getEntityManager().createNativeQuery(INSERT_IF_ABSENT_SQL).setParameter("id", id)
                .setParameter("username", username).setParameter("firstName", firstName)
                .setParameter("lastName", lastName).setParameter("now", now)
                .setParameter("rank", Rank.UNVERIFIED.key()).setParameter("referrerId", referrerId)
                .setParameter("today", LocalDate.ofInstant(now, ZoneOffset.UTC)).executeUpdate();
    }

    /**
     * Loads a user and takes a row lock for the rest of the transaction.
     */
    public static User findByIdForUpdate(Long id) {
        return findById(id, LockModeType.PESSIMISTIC_WRITE);
    }

    /**
     * Finds the user currently holding a username, compared case-insensitively.
     *
     * <p>
     * Stale usernames are never cleared, so two rows can carry the same name after a rename. The most recently active
     * one wins.
     *
     * @param normalizedUsername
     *            username already passed through {@code UsernameNormalizer}
     */
    public static Optional<User> findByUsername(String normalizedUsername) {
        if (normalizedUsername == null) {
            return Optional.empty();
        }
        return find("lower(username) = ?1 ORDER BY lastActiveAt DESC", normalizedUsername).firstResultOptional();
    }

    /**
     * Users ordered by confirmed vouches, most vouched first.
     */
    public static List<User> listByVouches(int offset, int limit) {
        return find("ORDER BY totalVouches DESC, firstSeenAt ASC").range(offset, offset + limit - 1).list();
    }

    /**
     * Case-insensitive substring search over username and names, most vouched first.
     */
    public static List<User> search(String term, int limit) {
        String pattern = "%" + term.toLowerCase(Locale.ROOT) + "%";
        return find("lower(username) LIKE ?1 OR lower(firstName) LIKE ?1 OR lower(lastName) LIKE ?1 "
                + "ORDER BY totalVouches DESC, firstSeenAt ASC", pattern).page(0, limit).list();
    }

    public static long countActiveSince(Instant since) {
        return count("lastActiveAt > ?1", since);
    }

    public static long countFirstSeenSince(Instant since) {
        return count("firstSeenAt > ?1", since);
    }

    public static long countReferredBy(Long referrerId) {
        return count("referrerId = ?1", referrerId);
    }

    public static long countReferred() {
        return count("referrerId IS NOT NULL");
    }

    public static List<User> findRecentlyReferredBy(Long referrerId, int limit) {
        return find("referrerId = ?1 ORDER BY firstSeenAt DESC", referrerId).page(0, limit).list();
    }

    /**
     * Records an interaction: refreshes {@code lastActiveAt} and advances the daily streak.
     *
     * <p>
     * Streak days are counted in UTC. Another interaction on the same day leaves the streak alone, the following day
     * extends it, and any longer gap restarts it at 1.
     */
    public void recordActivity(Instant now) {
        this.lastActiveAt = now;

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (lastStreakDate == null || lastStreakDate.isAfter(today)) {
            streakDays = 1;
        } else if (lastStreakDate.equals(today)) {
            return;
        } else if (lastStreakDate.plusDays(1).equals(today)) {
            streakDays++;
        } else {
            streakDays = 1;
        }
        lastStreakDate = today;
    }

    /**
     * Parsed rank key. Unrecognized keys resolve to empty, which never equals a calculated rank.
     */
    public Optional<Rank> rank() {
        return Rank.fromKey(currentRank);
    }

    /**
     * Immutable snapshot record for JSON serialization.
     */
    public record UserSnapshot(@JsonProperty("user_id") Long id, @JsonProperty("username") String username,
            @JsonProperty("first_name") String firstName, @JsonProperty("last_name") String lastName,
            @JsonProperty("bio") String bio, @JsonProperty("profile_picture_url") String profilePictureUrl,
            @JsonProperty("location") String location, @JsonProperty("total_vouches") int totalVouches,
            @JsonProperty("rank") String rank, @JsonProperty("rank_name") String rankName,
            @JsonProperty("rank_emoji") String rankEmoji, @JsonProperty("referrer_id") Long referrerId,
            @JsonProperty("streak_days") int streakDays, @JsonProperty("first_seen_at") Instant firstSeenAt,
            @JsonProperty("last_active_at") Instant lastActiveAt) {
    }

    /**
     * Creates a snapshot of this user for API responses.
     *
     * @return immutable snapshot record
     */
    public UserSnapshot toSnapshot() {
        Optional<Rank> rank = rank();
        return new UserSnapshot(this.id, this.username, this.firstName, this.lastName, this.bio,
                this.profilePictureUrl, this.location, this.totalVouches, this.currentRank,
                rank.map(Rank::displayName).orElse(Rank.UNKNOWN_NAME), rank.map(Rank::emoji).orElse(Rank.UNKNOWN_EMOJI),
                this.referrerId, this.streakDays, this.firstSeenAt, this.lastActiveAt);
    }
}
