package villagecompute.vouch.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.LockModeType;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * UsernameLock entity: one row per normalized username, used only as a transaction-scoped mutex.
 *
 * <p>
 * Creating a pending vouch for a username and taking that username (signup or rename) both lock this row before
 * looking at the other side. Whichever commits second then sees the first one's rows, so a pending vouch is never
 * created for a user who has already claimed the name without being resolved.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code username} (TEXT, PK) - Normalized username</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - First time the name was locked</li>
 * </ul>
 */
@Entity
@Table(
        name = "username_locks")
public class UsernameLock extends PanacheEntityBase {

    private static final String INSERT_IF_ABSENT_SQL = """
            INSERT INTO username_locks (username, created_at)
            VALUES (:username, :now)
            ON CONFLICT DO NOTHING
            """;

    @Id
    @Column(
            nullable = false)
    public String username;

    @Column(
            name = "created_at",
            nullable = false,
            updatable = false)
    public Instant createdAt;

    /**
     * Blocks until this transaction holds the lock row for the username. Re-acquiring within the same transaction
     * returns immediately.
     *
     * @param normalizedUsername
     *            username already passed through {@code UsernameNormalizer}
     */
    public static void acquire(String normalizedUsername) {
        getEntityManager().createNativeQuery(INSERT_IF_ABSENT_SQL).setParameter("username", normalizedUsername)
                .setParameter("now", Instant.now()).executeUpdate();
        findById(normalizedUsername, LockModeType.PESSIMISTIC_WRITE);
    }
}
