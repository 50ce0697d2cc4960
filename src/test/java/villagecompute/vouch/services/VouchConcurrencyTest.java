package villagecompute.vouch.services;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.data.models.Vouch;
import villagecompute.vouch.exceptions.DuplicateVouchException;
import villagecompute.vouch.testing.H2TestResource;
import villagecompute.vouch.testing.TestFixtures;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static villagecompute.vouch.testing.TestFixtures.*;

/**
 * Races vouch creation and first contact from several threads and checks that totals match the rows actually
 * stored. Pending vouches are also raced against the signup that claims their username.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class VouchConcurrencyTest {

    private static final int THREADS = 6;

    @Inject
    VouchLedgerService ledger;

    @Inject
    UserDirectoryService directory;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.deleteAll();
    }

    @Test
    void testConcurrentDuplicateVouches_exactlyOneSucceeds() throws Exception {
        directory.getOrCreate(ALICE_ID, "alice", null, null, null);
        directory.getOrCreate(BOB_ID, "bob", null, null, null);

        List<Throwable> failures = race(() -> ledger.createVouch(ALICE_ID, BOB_ID, null, "racing"));

        assertEquals(THREADS - 1, failures.size());
        assertTrue(failures.stream().allMatch(DuplicateVouchException.class::isInstance),
                "Losers must see a duplicate rejection, got " + failures);
        assertEquals(1, reload(BOB_ID).totalVouches);
        assertEquals(1L, inTransaction(() -> Vouch.countReceivedBy(BOB_ID)));
    }

    @Test
    void testConcurrentVouchesFromDifferentSources_allCounted() throws Exception {
        directory.getOrCreate(DAVE_ID, "dave", null, null, null);
        List<Long> sources = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            Long sourceId = 2000L + i;
            directory.getOrCreate(sourceId, "source" + i, null, null, null);
            sources.add(sourceId);
        }

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<VouchOutcome>> futures = new ArrayList<>();
            for (Long sourceId : sources) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledger.createVouch(sourceId, DAVE_ID, null, null);
                }));
            }
            start.countDown();
            for (Future<VouchOutcome> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(THREADS, reload(DAVE_ID).totalVouches);
        assertEquals("trusted", reload(DAVE_ID).currentRank);
    }

    @Test
    void testConcurrentPendingVouches_exactlyOneStored() throws Exception {
        directory.getOrCreate(ALICE_ID, "alice", null, null, null);

        List<Throwable> failures = race(() -> ledger.createVouch(ALICE_ID, null, "@latecomer", null));

        assertEquals(THREADS - 1, failures.size());
        assertEquals(1L, inTransaction(() -> Vouch.countPending()));
    }

    @Test
    void testConcurrentFirstContact_singleUserAndSignup() throws Exception {
        List<Throwable> failures = race(() -> directory.getOrCreate(ERIN_ID, "erin", "Erin", null, null));

        assertTrue(failures.isEmpty(), "First contact must never fail, got " + failures);
        assertEquals(1L, inTransaction(() -> User.count("id = ?1", ERIN_ID)));
        assertEquals(1, eventCount(DomainEvent.TYPE_USER_SIGNUP, ERIN_ID));
    }

    @Test
    void testPendingVouchDuringSignup_resolvedOnCommit() throws Exception {
        directory.getOrCreate(ALICE_ID, "alice", null, null, null);

        holdOpenWhileRunning(() -> ledger.createVouch(ALICE_ID, null, "latecomer", "welcome"),
                () -> directory.getOrCreate(ERIN_ID, "latecomer", null, null, null));

        assertEquals(0L, inTransaction(() -> Vouch.countPending()));
        assertEquals(1, reload(ERIN_ID).totalVouches);
        assertEquals(1L, inTransaction(() -> Vouch.countReceivedBy(ERIN_ID)));
    }

    @Test
    void testSignupDuringPendingVouch_vouchConfirmed() throws Exception {
        directory.getOrCreate(ALICE_ID, "alice", null, null, null);

        holdOpenWhileRunning(() -> directory.getOrCreate(ERIN_ID, "latecomer", null, null, null),
                () -> ledger.createVouch(ALICE_ID, null, "@Latecomer", "welcome"));

        assertEquals(0L, inTransaction(() -> Vouch.countPending()));
        assertEquals(1, reload(ERIN_ID).totalVouches);
    }

    /**
     * Runs {@code first} in a transaction that stays open while {@code second} starts on another thread, then
     * commits. Both must complete.
     */
    private void holdOpenWhileRunning(Callable<?> first, Callable<?> second) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            CountDownLatch firstDone = new CountDownLatch(1);
            Future<?> holder = executor.submit(() -> QuarkusTransaction.requiringNew().call(() -> {
                Object result = first.call();
                firstDone.countDown();
                Thread.sleep(500);
                return result;
            }));
            Future<?> contender = executor.submit(() -> {
                firstDone.await();
                return second.call();
            });

            holder.get(30, TimeUnit.SECONDS);
            contender.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Runs the same call on every thread at once and returns the failures.
     */
    private List<Throwable> race(Callable<?> call) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        List<Throwable> failures = new ArrayList<>();
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                } catch (TimeoutException e) {
                    fail("Vouch call did not finish in time");
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return failures;
    }
}
