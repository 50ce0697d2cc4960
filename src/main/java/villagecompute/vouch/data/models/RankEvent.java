package villagecompute.vouch.data.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;

/**
 * RankEvent entity implementing the Panache ActiveRecord pattern for the append-only rank transition history.
 *
 * <p>
 * One row per rank change, written in the same transaction as the change itself.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Primary identifier</li>
 * <li>{@code user_id} (BIGINT, FK) - User whose rank changed</li>
 * <li>{@code old_rank} (TEXT) - Rank key before the change</li>
 * <li>{@code new_rank} (TEXT) - Rank key after the change</li>
 * <li>{@code total_vouches} (INT) - Vouch count that produced the new rank</li>
 * <li>{@code trigger_type} (TEXT) - What caused the change</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Timestamp of the change</li>
 * </ul>
 */
@Entity
@Table(
        name = "rank_events")
public class RankEvent extends PanacheEntityBase {

    public static final String TRIGGER_VOUCH_RECEIVED = "vouch_received";
    public static final String TRIGGER_PENDING_RESOLVED = "pending_resolved";
    public static final String TRIGGER_ADMIN_ADJUSTMENT = "admin_adjustment";
    public static final String TRIGGER_ADMIN_RANK_CHANGE = "admin_rank_change";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "user_id",
            nullable = false)
    public Long userId;

    @Column(
            name = "old_rank",
            nullable = false)
    public String oldRank;

    @Column(
            name = "new_rank",
            nullable = false)
    public String newRank;

    @Column(
            name = "total_vouches",
            nullable = false)
    public int totalVouches;

    @Column(
            name = "trigger_type",
            nullable = false)
    public String triggerType;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Rank history for a user, most recent first.
     */
    public static List<RankEvent> findByUserId(Long userId) {
        return find("userId = ?1 ORDER BY createdAt DESC, id DESC", userId).list();
    }

    public static long countByUserId(Long userId) {
        return count("userId = ?1", userId);
    }

    /**
     * Creates and persists a rank transition record.
     *
     * @param oldRank
     *            stored rank key before the change (may be an unrecognized legacy key)
     * @return persisted record
     */
    public static RankEvent create(Long userId, String oldRank, Rank newRank, int totalVouches, String triggerType) {
        RankEvent event = new RankEvent();
        event.userId = userId;
        event.oldRank = oldRank == null ? Rank.UNVERIFIED.key() : oldRank;
        event.newRank = newRank.key();
        event.totalVouches = totalVouches;
        event.triggerType = triggerType;
        event.createdAt = Instant.now();

        event.persist();
        return event;
    }

    /**
     * Immutable snapshot record for JSON serialization.
     */
    public record RankEventSnapshot(@JsonProperty("id") Long id, @JsonProperty("user_id") Long userId,
            @JsonProperty("old_rank") String oldRank, @JsonProperty("new_rank") String newRank,
            @JsonProperty("total_vouches") int totalVouches, @JsonProperty("trigger_type") String triggerType,
            @JsonProperty("created_at") Instant createdAt) {
    }

    public RankEventSnapshot toSnapshot() {
        return new RankEventSnapshot(this.id, this.userId, this.oldRank, this.newRank, this.totalVouches,
                this.triggerType, this.createdAt);
    }
}
