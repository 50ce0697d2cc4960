package villagecompute.vouch.services;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.data.models.Rank;
import villagecompute.vouch.data.models.RankEvent;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.data.models.Vouch;
import villagecompute.vouch.exceptions.DuplicateVouchException;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.PermissionDeniedException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.exceptions.SelfVouchException;
import villagecompute.vouch.testing.H2TestResource;
import villagecompute.vouch.testing.TestFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static villagecompute.vouch.testing.TestFixtures.*;

/**
 * Integration tests for {@link VouchLedgerService}.
 *
 * <p>
 * Tests cover:
 * <ul>
 * <li>Confirmed vouches by id and by username</li>
 * <li>Pending vouches and their resolution on sign-up and rename</li>
 * <li>Duplicate, self and unknown-user rejections</li>
 * <li>Rank promotion, rank history and mutual vouch detection</li>
 * <li>Message sanitizing and editing</li>
 * <li>Admin vouch count corrections</li>
 * </ul>
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class VouchLedgerServiceTest {

    @Inject
    VouchLedgerService ledger;

    @Inject
    UserDirectoryService directory;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.deleteAll();
    }

    private void createUsers() {
        directory.getOrCreate(ALICE_ID, "alice", "Alice", null, null);
        directory.getOrCreate(BOB_ID, "Bob", "Bob", null, null);
        directory.getOrCreate(CAROL_ID, "carol", "Carol", null, null);
        directory.getOrCreate(DAVE_ID, "dave", "Dave", null, null);
    }

    // ========== Confirmed vouches ==========

    @Test
    void testCreateVouch_byId_incrementsTotal() {
        createUsers();

        VouchOutcome outcome = ledger.createVouch(ALICE_ID, BOB_ID, null, "Reliable");

        assertFalse(outcome.pending());
        assertFalse(outcome.mutual());
        assertFalse(outcome.rankChanged());
        assertEquals(BOB_ID, outcome.vouch().targetUserId);
        assertEquals("bob", outcome.vouch().targetUsername);
        assertEquals(1, outcome.rankChange().newTotal());

        User bob = reload(BOB_ID);
        assertEquals(1, bob.totalVouches);
        assertEquals(Rank.UNVERIFIED.key(), bob.currentRank);
        assertEquals(1, eventCount(DomainEvent.TYPE_VOUCH_CREATED, ALICE_ID));
    }

    @Test
    void testCreateVouch_byUsername_matchesCaseInsensitively() {
        createUsers();

        VouchOutcome outcome = ledger.createVouch(ALICE_ID, null, "@BOB", null);

        assertFalse(outcome.pending());
        assertEquals(BOB_ID, outcome.vouch().targetUserId);
        assertNull(outcome.vouch().message);
        assertEquals(1, reload(BOB_ID).totalVouches);
    }

    @Test
    void testCreateVouch_thirdVouch_promotesToVerified() {
        createUsers();
        ledger.createVouch(ALICE_ID, DAVE_ID, null, null);
        ledger.createVouch(BOB_ID, DAVE_ID, null, null);

        VouchOutcome third = ledger.createVouch(CAROL_ID, DAVE_ID, null, null);

        assertTrue(third.rankChanged());
        assertTrue(third.rankChange().promoted());
        assertEquals(Rank.UNVERIFIED, third.rankChange().oldRank());
        assertEquals(Rank.VERIFIED, third.rankChange().newRank());

        User dave = reload(DAVE_ID);
        assertEquals(3, dave.totalVouches);
        assertEquals(Rank.VERIFIED.key(), dave.currentRank);

        List<RankEvent> history = inTransaction(() -> RankEvent.findByUserId(DAVE_ID));
        assertEquals(1, history.size());
        assertEquals("unverified", history.get(0).oldRank);
        assertEquals("verified", history.get(0).newRank);
        assertEquals(3, history.get(0).totalVouches);
        assertEquals(RankEvent.TRIGGER_VOUCH_RECEIVED, history.get(0).triggerType);
        assertEquals(1, eventCount(DomainEvent.TYPE_RANK_UP, DAVE_ID));
    }

    @Test
    void testCreateVouch_reverseDirection_isMutual() {
        createUsers();
        ledger.createVouch(ALICE_ID, BOB_ID, null, null);

        VouchOutcome reverse = ledger.createVouch(BOB_ID, ALICE_ID, null, null);

        assertTrue(reverse.mutual());
        assertEquals(1, eventCount(DomainEvent.TYPE_MUTUAL_VOUCH, BOB_ID));
    }

    @Test
    void testCreateVouch_sanitizesMessage() {
        createUsers();

        VouchOutcome outcome = ledger.createVouch(ALICE_ID, BOB_ID, null, "Definitely not a SCAM");

        assertEquals("Definitely not a [redacted]", outcome.vouch().message);
    }

    // ========== Rejections ==========

    @Test
    void testCreateVouch_duplicate_rejectedWithoutMutation() {
        createUsers();
        ledger.createVouch(ALICE_ID, BOB_ID, null, null);

        assertThrows(DuplicateVouchException.class, () -> ledger.createVouch(ALICE_ID, BOB_ID, null, "again"));
        assertThrows(DuplicateVouchException.class, () -> ledger.createVouch(ALICE_ID, null, "bob", "again"));

        assertEquals(1, reload(BOB_ID).totalVouches);
        assertEquals(1L, inTransaction(() -> Vouch.countGivenBy(ALICE_ID)));
    }

    @Test
    void testCreateVouch_self_rejected() {
        createUsers();

        assertThrows(SelfVouchException.class, () -> ledger.createVouch(ALICE_ID, ALICE_ID, null, null));
        assertThrows(SelfVouchException.class, () -> ledger.createVouch(ALICE_ID, null, "@Alice", null));

        assertEquals(0, reload(ALICE_ID).totalVouches);
    }

    @Test
    void testCreateVouch_missingTarget_invalid() {
        createUsers();

        assertThrows(InvalidRequestException.class, () -> ledger.createVouch(ALICE_ID, null, null, null));
        assertThrows(InvalidRequestException.class, () -> ledger.createVouch(ALICE_ID, null, " @ ", null));
    }

    @Test
    void testCreateVouch_unknownUsers_notFound() {
        createUsers();

        assertThrows(ResourceNotFoundException.class, () -> ledger.createVouch(4242L, BOB_ID, null, null));
        assertThrows(ResourceNotFoundException.class, () -> ledger.createVouch(ALICE_ID, 4242L, null, null));
    }

    // ========== Pending vouches ==========

    @Test
    void testCreateVouch_unknownUsername_createsPending() {
        createUsers();

        VouchOutcome outcome = ledger.createVouch(ALICE_ID, null, "@NewComer", "Welcome");

        assertTrue(outcome.pending());
        assertNull(outcome.rankChange());
        assertNull(outcome.vouch().targetUserId);
        assertEquals("newcomer", outcome.vouch().targetUsername);
        assertEquals(1, eventCount(DomainEvent.TYPE_PENDING_VOUCH_CREATED, ALICE_ID));

        assertThrows(DuplicateVouchException.class, () -> ledger.createVouch(ALICE_ID, null, "newcomer", null));
    }

    @Test
    void testPendingVouches_resolvedOnSignup() {
        createUsers();
        ledger.createVouch(ALICE_ID, null, "newcomer", null);
        ledger.createVouch(BOB_ID, null, "@NEWCOMER", null);
        ledger.createVouch(CAROL_ID, null, "newcomer", null);

        directory.getOrCreate(ERIN_ID, "NewComer", "Erin", null, null);

        User erin = reload(ERIN_ID);
        assertEquals(3, erin.totalVouches);
        assertEquals(Rank.VERIFIED.key(), erin.currentRank);

        List<Vouch> received = ledger.vouchesReceived(ERIN_ID);
        assertEquals(3, received.size());
        assertTrue(received.stream().noneMatch(vouch -> vouch.isPending));

        List<DomainEvent> processed = inTransaction(
                () -> DomainEvent.findByTypeAndUser(DomainEvent.TYPE_PENDING_VOUCHES_PROCESSED, ERIN_ID));
        assertEquals(1, processed.size());
        assertEquals(3, ((Number) processed.get(0).metadata.get("vouches_processed")).intValue());
        assertEquals("verified", processed.get(0).metadata.get("new_rank"));

        List<RankEvent> history = inTransaction(() -> RankEvent.findByUserId(ERIN_ID));
        assertEquals(1, history.size());
        assertEquals(RankEvent.TRIGGER_PENDING_RESOLVED, history.get(0).triggerType);
    }

    @Test
    void testResolvePendingVouches_secondCall_noSideEffects() {
        createUsers();
        ledger.createVouch(ALICE_ID, null, "newcomer", null);
        directory.getOrCreate(ERIN_ID, "newcomer", "Erin", null, null);

        PendingResolution again = ledger.resolvePendingVouches(ERIN_ID, "newcomer");

        assertEquals(0, again.resolved());
        assertEquals(1, reload(ERIN_ID).totalVouches);
        assertEquals(1, eventCount(DomainEvent.TYPE_PENDING_VOUCHES_PROCESSED, ERIN_ID));
    }

    @Test
    void testPendingVouches_resolvedOnRename() {
        createUsers();
        ledger.createVouch(ALICE_ID, null, "dave_the_brave", null);

        directory.getOrCreate(DAVE_ID, "Dave_The_Brave", null, null, null);

        assertEquals(1, reload(DAVE_ID).totalVouches);
        assertEquals("Dave_The_Brave", reload(DAVE_ID).username);
    }

    @Test
    void testPendingVouches_completingMutualPair_emitsMutualEvent() {
        createUsers();
        ledger.createVouch(ALICE_ID, null, "newcomer", null);
        directory.getOrCreate(ERIN_ID, null, "Erin", null, null);
        ledger.createVouch(ERIN_ID, ALICE_ID, null, null);

        directory.getOrCreate(ERIN_ID, "newcomer", null, null, null);

        assertEquals(1, eventCount(DomainEvent.TYPE_MUTUAL_VOUCH, ALICE_ID));
    }

    /**
     * A pending vouch whose source already vouched for the user directly stays pending and is not counted twice.
     */
    @Test
    void testPendingVouches_existingDirectVouch_skipped() {
        createUsers();
        ledger.createVouch(ALICE_ID, null, "captain", null);
        ledger.createVouch(ALICE_ID, DAVE_ID, null, null);

        PendingResolution resolution = ledger.resolvePendingVouches(DAVE_ID, "captain");

        assertEquals(0, resolution.resolved());
        assertEquals(1, resolution.skipped());
        assertEquals(1, reload(DAVE_ID).totalVouches);
        assertEquals(1L, inTransaction(() -> Vouch.countPending()));
    }

    @Test
    void testPendingVouches_ownPendingVouch_skipped() {
        createUsers();
        ledger.createVouch(ALICE_ID, null, "wonderland", null);

        directory.getOrCreate(ALICE_ID, "wonderland", null, null, null);

        assertEquals(0, reload(ALICE_ID).totalVouches);
        assertEquals(1L, inTransaction(() -> Vouch.countPending()));
    }

    // ========== Editing ==========

    @Test
    void testUpdateVouch_byAuthor_replacesMessage() {
        createUsers();
        Vouch vouch = ledger.createVouch(ALICE_ID, BOB_ID, null, "ok").vouch();

        Vouch updated = ledger.updateVouch(vouch.id, ALICE_ID, "Very fake review");

        assertEquals("Very [redacted] review", updated.message);
        assertNotNull(updated.updatedAt);
        assertEquals(1, reload(BOB_ID).totalVouches);
        assertEquals(1, eventCount(DomainEvent.TYPE_VOUCH_UPDATED, ALICE_ID));
    }

    @Test
    void testUpdateVouch_byOtherUser_denied() {
        createUsers();
        Vouch vouch = ledger.createVouch(ALICE_ID, BOB_ID, null, "ok").vouch();

        assertThrows(PermissionDeniedException.class, () -> ledger.updateVouch(vouch.id, BOB_ID, "hijacked"));
        assertThrows(ResourceNotFoundException.class, () -> ledger.updateVouch(-1L, ALICE_ID, "nothing"));
    }

    // ========== Admin corrections ==========

    @Test
    void testAdminAdjust_promotesAndRecordsAudit() {
        createUsers();

        RankChange change = ledger.adminAdjustVouchCount(BOB_ID, 6, "Imported from legacy system", ADMIN_ID);

        assertEquals(0, change.oldTotal());
        assertEquals(6, change.newTotal());
        assertEquals(Rank.TRUSTED, change.newRank());
        assertEquals(Rank.TRUSTED.key(), reload(BOB_ID).currentRank);
        assertEquals(1, eventCount(DomainEvent.TYPE_ADMIN_VOUCH_ADJUSTMENT, BOB_ID));

        List<RankEvent> history = inTransaction(() -> RankEvent.findByUserId(BOB_ID));
        assertEquals(RankEvent.TRIGGER_ADMIN_ADJUSTMENT, history.get(0).triggerType);
    }

    @Test
    void testAdminAdjust_floorsAtZero() {
        createUsers();
        ledger.createVouch(ALICE_ID, BOB_ID, null, null);

        RankChange change = ledger.adminAdjustVouchCount(BOB_ID, -5, "Spam ring", ADMIN_ID);

        assertEquals(0, change.newTotal());
        assertFalse(change.changed());
        assertEquals(0, reload(BOB_ID).totalVouches);
    }

    @Test
    void testAdminAdjust_overflow_rejectedWithoutMutation() {
        createUsers();
        ledger.adminAdjustVouchCount(BOB_ID, 10, "Imported", ADMIN_ID);

        assertThrows(InvalidRequestException.class,
                () -> ledger.adminAdjustVouchCount(BOB_ID, Integer.MAX_VALUE, "Fat finger", ADMIN_ID));

        assertEquals(10, reload(BOB_ID).totalVouches);
        assertEquals(1, eventCount(DomainEvent.TYPE_ADMIN_VOUCH_ADJUSTMENT, BOB_ID));
    }

    @Test
    void testAdminAdjust_invalidInput() {
        createUsers();

        assertThrows(InvalidRequestException.class, () -> ledger.adminAdjustVouchCount(BOB_ID, 0, "noop", ADMIN_ID));
        assertThrows(InvalidRequestException.class, () -> ledger.adminAdjustVouchCount(BOB_ID, 2, " ", ADMIN_ID));
        assertThrows(ResourceNotFoundException.class,
                () -> ledger.adminAdjustVouchCount(4242L, 2, "ghost", ADMIN_ID));
    }
}
