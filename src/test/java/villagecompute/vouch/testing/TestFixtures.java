package villagecompute.vouch.testing;

import io.quarkus.narayana.jta.QuarkusTransaction;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.data.models.Invite;
import villagecompute.vouch.data.models.RankEvent;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.data.models.UsernameLock;
import villagecompute.vouch.data.models.Vouch;

import java.util.concurrent.Callable;

/**
 * Shared test data helpers.
 *
 * <p>
 * Tests are not transactional themselves: services commit their own work, and assertions read back through
 * {@link #inTransaction(Callable)} so they see exactly what was committed.
 */
public final class TestFixtures {

    public static final Long ALICE_ID = 1001L;
    public static final Long BOB_ID = 1002L;
    public static final Long CAROL_ID = 1003L;
    public static final Long DAVE_ID = 1004L;
    public static final Long ERIN_ID = 1005L;

    public static final Long ADMIN_ID = 999L;

    private TestFixtures() {
    }

    /**
     * Deletes every row, children first. Must run inside a transaction.
     */
    public static void deleteAll() {
        DomainEvent.deleteAll();
        RankEvent.deleteAll();
        Invite.deleteAll();
        Vouch.deleteAll();
        User.deleteAll();
        UsernameLock.deleteAll();
    }

    public static <T> T inTransaction(Callable<T> work) {
        return QuarkusTransaction.requiringNew().call(work);
    }

    public static User reload(Long userId) {
        return inTransaction(() -> User.<User>findById(userId));
    }

    public static long eventCount(String eventType, Long userId) {
        return inTransaction(() -> DomainEvent.countByTypeAndUser(eventType, userId));
    }
}
