package villagecompute.vouch.data.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * DomainEvent entity implementing the Panache ActiveRecord pattern for the append-only audit and analytics log.
 *
 * <p>
 * Events are written and counted, never read back to drive business decisions.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Primary identifier</li>
 * <li>{@code event_type} (TEXT) - One of the {@code TYPE_*} constants</li>
 * <li>{@code user_id} (BIGINT, nullable) - User the event is attributed to</li>
 * <li>{@code metadata} (JSONB) - Free-form context</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Timestamp of the event</li>
 * </ul>
 */
@Entity
@Table(
        name = "events")
public class DomainEvent extends PanacheEntityBase {

    public static final String TYPE_USER_SIGNUP = "user_signup";
    public static final String TYPE_REFERRAL_SIGNUP = "referral_signup";
    public static final String TYPE_VOUCH_CREATED = "vouch_created";
    public static final String TYPE_PENDING_VOUCH_CREATED = "pending_vouch_created";
    public static final String TYPE_PENDING_VOUCHES_PROCESSED = "pending_vouches_processed";
    public static final String TYPE_MUTUAL_VOUCH = "mutual_vouch";
    public static final String TYPE_RANK_UP = "rank_up";
    public static final String TYPE_VOUCH_UPDATED = "vouch_updated";
    public static final String TYPE_ADMIN_VOUCH_ADJUSTMENT = "admin_vouch_adjustment";
    public static final String TYPE_INVITE_LOGGED = "invite_logged";
    public static final String TYPE_SHARE_CLICKED = "share_clicked";
    public static final String TYPE_PROFILE_UPDATED = "profile_updated";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "event_type",
            nullable = false)
    public String eventType;

    @Column(
            name = "user_id")
    public Long userId;

    @Column
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static long countByType(String eventType) {
        return count("eventType = ?1", eventType);
    }

    public static long countByTypeAndUser(String eventType, Long userId) {
        return count("eventType = ?1 AND userId = ?2", eventType, userId);
    }

    /**
     * Most recent events attributed to a user.
     */
    public static List<DomainEvent> findRecentByUserId(Long userId, int limit) {
        return find("userId = ?1 ORDER BY createdAt DESC, id DESC", userId).page(0, limit).list();
    }

    public static List<DomainEvent> findByTypeAndUser(String eventType, Long userId) {
        return find("eventType = ?1 AND userId = ?2 ORDER BY id ASC", eventType, userId).list();
    }

    /**
     * Immutable snapshot record for JSON serialization.
     */
    public record DomainEventSnapshot(@JsonProperty("id") Long id, @JsonProperty("event_type") String eventType,
            @JsonProperty("user_id") Long userId, @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("created_at") Instant createdAt) {
    }

    public DomainEventSnapshot toSnapshot() {
        return new DomainEventSnapshot(this.id, this.eventType, this.userId, this.metadata, this.createdAt);
    }
}
