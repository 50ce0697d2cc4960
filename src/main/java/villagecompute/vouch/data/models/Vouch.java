package villagecompute.vouch.data.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Vouch entity implementing the Panache ActiveRecord pattern for one user's endorsement of another.
 *
 * <p>
 * <b>States:</b>
 * <ul>
 * <li><b>pending</b> - target is known only by username ({@code targetUserId} null, {@code isPending} true)</li>
 * <li><b>confirmed</b> - target identity resolved ({@code targetUserId} set, {@code isPending} false)</li>
 * </ul>
 * Pending vouches move to confirmed when a user first appears with, or renames to, the stored username. The transition
 * never runs backwards.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Sequence number</li>
 * <li>{@code source_user_id} (BIGINT, FK) - User giving the vouch</li>
 * <li>{@code target_user_id} (BIGINT, FK, nullable) - User receiving the vouch once resolved</li>
 * <li>{@code target_username} (TEXT) - Normalized username snapshot</li>
 * <li>{@code message} (TEXT) - Sanitized message, at most 120 characters</li>
 * <li>{@code is_pending} (BOOLEAN)</li>
 * <li>{@code created_at}, {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 *
 * <p>
 * The unique constraint on (source_user_id, target_user_id) backs the duplicate check in the ledger.
 *
 * @see User
 */
@Entity
@Table(
        name = "vouches",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_vouches_source_target",
                columnNames = {"source_user_id", "target_user_id"}))
public class Vouch extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "source_user_id",
            nullable = false,
            updatable = false)
    public Long sourceUserId;

    @Column(
            name = "target_user_id")
    public Long targetUserId;

    @Column(
            name = "target_username")
    public String targetUsername;

    @Column
    public String message;

    @Column(
            name = "is_pending",
            nullable = false)
    public boolean isPending;

    @Column(
            name = "created_at",
            nullable = false,
            updatable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at")
    public Instant updatedAt;

    /**
     * Finds the vouch from one user to a resolved target, whatever its state.
     */
    public static Optional<Vouch> findBySourceAndTarget(Long sourceUserId, Long targetUserId) {
        return find("sourceUserId = ?1 AND targetUserId = ?2", sourceUserId, targetUserId).firstResultOptional();
    }

    /**
     * Finds a pending vouch from one user to a not-yet-joined username.
     *
     * @param normalizedUsername
     *            username already passed through {@code UsernameNormalizer}
     */
    public static Optional<Vouch> findPendingBySourceAndUsername(Long sourceUserId, String normalizedUsername) {
        return find("sourceUserId = ?1 AND isPending = true AND lower(targetUsername) = ?2", sourceUserId,
                normalizedUsername).firstResultOptional();
    }

    /**
     * All pending vouches waiting for a username, oldest first.
     */
    public static List<Vouch> findPendingByUsername(String normalizedUsername) {
        return find("isPending = true AND lower(targetUsername) = ?1 ORDER BY id ASC", normalizedUsername).list();
    }

    /**
     * Confirmed vouches a user has received, most recent first.
     */
    public static List<Vouch> findReceivedBy(Long targetUserId) {
        return find("targetUserId = ?1 AND isPending = false ORDER BY createdAt DESC, id DESC", targetUserId).list();
    }

    /**
     * Every vouch a user has given, pending ones included, most recent first.
     */
    public static List<Vouch> findGivenBy(Long sourceUserId) {
        return find("sourceUserId = ?1 ORDER BY createdAt DESC, id DESC", sourceUserId).list();
    }

    public static long countReceivedBy(Long targetUserId) {
        return count("targetUserId = ?1 AND isPending = false", targetUserId);
    }

    public static long countGivenBy(Long sourceUserId) {
        return count("sourceUserId = ?1", sourceUserId);
    }

    public static long countCreatedSince(Instant since) {
        return count("createdAt > ?1", since);
    }

    public static long countPending() {
        return count("isPending = true");
    }

    public static List<Vouch> findRecentConfirmed(int limit) {
        return find("isPending = false ORDER BY createdAt DESC, id DESC").page(0, limit).list();
    }

    /**
     * Builds an unsaved confirmed vouch.
     */
    public static Vouch confirmed(Long sourceUserId, Long targetUserId, String normalizedUsername, String message) {
        Vouch vouch = new Vouch();
        vouch.sourceUserId = sourceUserId;
        vouch.targetUserId = targetUserId;
        vouch.targetUsername = normalizedUsername;
        vouch.message = message;
        vouch.isPending = false;
        vouch.createdAt = Instant.now();
        return vouch;
    }

    /**
     * Builds an unsaved pending vouch addressed to a username.
     */
    public static Vouch pending(Long sourceUserId, String normalizedUsername, String message) {
        Vouch vouch = new Vouch();
        vouch.sourceUserId = sourceUserId;
        vouch.targetUsername = normalizedUsername;
        vouch.message = message;
        vouch.isPending = true;
        vouch.createdAt = Instant.now();
        return vouch;
    }

    /**
     * Binds a pending vouch to the user who now holds its username.
     *
     * @throws IllegalStateException
     *             if the vouch is already confirmed
     */
    public void confirm(Long targetUserId) {
        if (!isPending) {
            throw new IllegalStateException("Vouch " + id + " is already confirmed");
        }
        this.targetUserId = targetUserId;
        this.isPending = false;
        this.updatedAt = Instant.now();
    }

    /**
     * Immutable snapshot record for JSON serialization.
     */
    public record VouchSnapshot(@JsonProperty("id") Long id, @JsonProperty("from_user_id") Long sourceUserId,
            @JsonProperty("to_user_id") Long targetUserId, @JsonProperty("to_username") String targetUsername,
            @JsonProperty("message") String message, @JsonProperty("is_pending") boolean isPending,
            @JsonProperty("created_at") Instant createdAt, @JsonProperty("updated_at") Instant updatedAt) {
    }

    /**
     * Creates a snapshot of this vouch for API responses.
     *
     * @return immutable snapshot record
     */
    public VouchSnapshot toSnapshot() {
        return new VouchSnapshot(this.id, this.sourceUserId, this.targetUserId, this.targetUsername, this.message,
                this.isPending, this.createdAt, this.updatedAt);
    }
}
