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
import java.util.Optional;

/**
 * Invite entity recording that a user invited a not-yet-joined username. Only used for the invite cooldown.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK)</li>
 * <li>{@code source_user_id} (BIGINT, FK) - Inviting user</li>
 * <li>{@code target_username} (TEXT) - Normalized invited username</li>
 * <li>{@code sent_at} (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "invites")
public class Invite extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "source_user_id",
            nullable = false)
    public Long sourceUserId;

    @Column(
            name = "target_username",
            nullable = false)
    public String targetUsername;

    @Column(
            name = "sent_at",
            nullable = false)
    public Instant sentAt;

    /**
     * Latest invite from a user to a username sent after the given instant.
     */
    public static Optional<Invite> findLatestSince(Long sourceUserId, String normalizedUsername, Instant since) {
        return find("sourceUserId = ?1 AND targetUsername = ?2 AND sentAt > ?3 ORDER BY sentAt DESC", sourceUserId,
                normalizedUsername, since).firstResultOptional();
    }

    public static Invite create(Long sourceUserId, String normalizedUsername) {
        Invite invite = new Invite();
        invite.sourceUserId = sourceUserId;
        invite.targetUsername = normalizedUsername;
        invite.sentAt = Instant.now();
        invite.persist();
        return invite;
    }

    public record InviteSnapshot(@JsonProperty("id") Long id, @JsonProperty("from_user_id") Long sourceUserId,
            @JsonProperty("to_username") String targetUsername, @JsonProperty("sent_at") Instant sentAt) {
    }

    public InviteSnapshot toSnapshot() {
        return new InviteSnapshot(this.id, this.sourceUserId, this.targetUsername, this.sentAt);
    }
}
