package villagecompute.vouch.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.data.models.Rank;
import villagecompute.vouch.data.models.RankEvent;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.data.models.UsernameLock;
import villagecompute.vouch.data.models.Vouch;
import villagecompute.vouch.exceptions.DuplicateVouchException;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.PermissionDeniedException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.exceptions.SelfVouchException;
import villagecompute.vouch.observability.VouchMetrics;
import villagecompute.vouch.util.UsernameNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static villagecompute.vouch.services.EventLogService.metadata;

/**
 * VouchLedgerService owns vouch creation, pending-vouch resolution and every change to a user's vouch total and rank.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Create confirmed vouches (target known) and pending vouches (target known only by username)</li>
 * <li>Reject duplicate and self vouches before any mutation</li>
 * <li>Bind pending vouches to a user when they join or take the matching username</li>
 * <li>Keep {@code totalVouches} and {@code currentRank} in step through a single recompute path</li>
 * <li>Record rank history and emit audit events</li>
 * </ul>
 *
 * <p>
 * <b>Transactions and locking:</b> every mutation runs in one transaction. User rows involved in a mutation are locked
 * with {@code SELECT ... FOR UPDATE} in ascending id order, which serializes concurrent vouches from the same source
 * and makes the duplicate check reliable. The unique constraint on (source_user_id, target_user_id) is the final
 * backstop and surfaces as {@link DuplicateVouchException}.
 *
 * <p>
 * <b>Usernames:</b> creating a pending vouch and resolving pending vouches both hold the {@link UsernameLock} for the
 * normalized name, and take it before any user row. A pending vouch racing its target's signup is therefore either
 * seen by the signup's resolution or finds the new user and is created confirmed.
 *
 * @see RankCalculationService
 * @see Vouch
 */
@ApplicationScoped
public class VouchLedgerService {

    private static final Logger LOG = Logger.getLogger(VouchLedgerService.class);

    @Inject
    RankCalculationService rankCalculator;

    @Inject
    ContentSanitizer sanitizer;

    @Inject
    EventLogService eventLog;

    @Inject
    VouchMetrics metrics;

    /**
     * Creates a vouch from one user to another.
     *
     * <p>
     * When {@code targetUserId} is absent the username is looked up case-insensitively. A match takes the confirmed
     * path; no match records a pending vouch under the normalized username.
     *
     * @param sourceUserId
     *            user giving the vouch (must exist)
     * @param targetUserId
     *            user receiving the vouch (optional)
     * @param targetUsername
     *            username of the receiver, with or without leading {@code @} (optional)
     * @param message
     *            free text, sanitized before storage (optional)
     * @return the persisted vouch, its effect on the target's rank and whether it completed a mutual pair
     * @throws InvalidRequestException
     *             if neither target id nor username is given
     * @throws ResourceNotFoundException
     *             if the source, or an explicitly given target id, does not exist
     * @throws DuplicateVouchException
     *             if the source already vouched for this target
     * @throws SelfVouchException
     *             if the target resolves to the source
     */
    @Transactional
    public VouchOutcome createVouch(Long sourceUserId, Long targetUserId, String targetUsername, String message) {
        if (sourceUserId == null) {
            throw reject("invalid_request", new InvalidRequestException("Source user id is required"));
        }

        String normalizedUsername = UsernameNormalizer.normalize(targetUsername);
        if (targetUserId == null && normalizedUsername == null) {
            throw reject("invalid_request",
                    new InvalidRequestException("Either a target user id or a target username is required"));
        }

        Long resolvedTargetId = targetUserId;
        if (resolvedTargetId == null) {
            UsernameLock.acquire(normalizedUsername);
            resolvedTargetId = User.findByUsername(normalizedUsername).map(user -> user.id).orElse(null);
        }

        User source;
        User target = null;
        if (resolvedTargetId == null || resolvedTargetId.equals(sourceUserId)) {
            source = User.findByIdForUpdate(sourceUserId);
        } else {
            List<User> locked = lockInIdOrder(sourceUserId, resolvedTargetId);
            source = locked.get(0);
            target = locked.get(1);
        }

        if (source == null) {
            throw reject("not_found", new ResourceNotFoundException("Source user not found: " + sourceUserId));
        }

        if (resolvedTargetId == null) {
            return createPending(source, normalizedUsername, message);
        }

        if (Vouch.findBySourceAndTarget(sourceUserId, resolvedTargetId).isPresent()) {
            throw reject("duplicate", new DuplicateVouchException(
                    "User " + sourceUserId + " has already vouched for user " + resolvedTargetId));
        }

        if (resolvedTargetId.equals(sourceUserId)) {
            throw reject("self_vouch", new SelfVouchException("Users cannot vouch for themselves"));
        }

        if (target == null) {
            throw reject("not_found", new ResourceNotFoundException("Target user not found: " + resolvedTargetId));
        }

        return createConfirmed(source, target, normalizedUsername, message);
    }

    private VouchOutcome createConfirmed(User source, User target, String normalizedUsername, String message) {
        String snapshotUsername = normalizedUsername != null ? normalizedUsername
                : UsernameNormalizer.normalize(target.username);
        Vouch vouch = Vouch.confirmed(source.id, target.id, snapshotUsername, sanitizeOptional(message));
        persistVouch(vouch);

        RankChange rankChange = applyVouchDelta(target, 1, RankEvent.TRIGGER_VOUCH_RECEIVED);

        boolean mutual = Vouch.findBySourceAndTarget(target.id, source.id).filter(reverse -> !reverse.isPending)
                .isPresent();
        if (mutual) {
            eventLog.log(DomainEvent.TYPE_MUTUAL_VOUCH, source.id, metadata("other_user", target.id));
        }

        eventLog.log(DomainEvent.TYPE_VOUCH_CREATED, source.id,
                metadata("to_user", target.id, "vouch_id", vouch.id, "vouch_count", rankChange.newTotal()));
        metrics.recordVouchCreated(false);

        LOG.infof("Vouch %d created: user %d -> user %d (total %d, rank %s%s)", vouch.id, source.id, target.id,
                rankChange.newTotal(), rankChange.newRank().key(), mutual ? ", mutual" : "");

        return new VouchOutcome(vouch, rankChange, mutual);
    }

    private VouchOutcome createPending(User source, String normalizedUsername, String message) {
        if (Vouch.findPendingBySourceAndUsername(source.id, normalizedUsername).isPresent()) {
            throw reject("duplicate", new DuplicateVouchException(
                    "User " + source.id + " already has a pending vouch for @" + normalizedUsername));
        }

        Vouch vouch = Vouch.pending(source.id, normalizedUsername, sanitizeOptional(message));
        persistVouch(vouch);

        eventLog.log(DomainEvent.TYPE_PENDING_VOUCH_CREATED, source.id,
                metadata("to_username", normalizedUsername, "vouch_id", vouch.id));
        metrics.recordVouchCreated(true);

        LOG.infof("Pending vouch %d created: user %d -> @%s", vouch.id, source.id, normalizedUsername);
        return new VouchOutcome(vouch, null, false);
    }

    /**
     * Binds every pending vouch addressed to a username to the user who now holds it.
     *
     * <p>
     * The user's total is increased once by the number of vouches confirmed and the rank is recomputed once. A
     * pending vouch is skipped, and stays pending, when confirming it would produce a self vouch or a second vouch
     * from a source that already vouched for this user directly.
     *
     * <p>
     * Re-invoking with no new pending matches has no side effects.
     *
     * @param userId
     *            user taking the username (must exist)
     * @param username
     *            username as supplied by the platform
     * @return what was resolved and how the user's rank moved
     * @throws ResourceNotFoundException
     *             if pending vouches exist but the user does not
     */
    @Transactional
    public PendingResolution resolvePendingVouches(Long userId, String username) {
        String normalized = UsernameNormalizer.normalize(username);
        if (normalized == null) {
            return PendingResolution.none(userId);
        }

        UsernameLock.acquire(normalized);
        List<Vouch> pending = Vouch.findPendingByUsername(normalized);
        if (pending.isEmpty()) {
            return PendingResolution.none(userId);
        }

        User user = User.findByIdForUpdate(userId);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }

        List<Vouch> resolved = new ArrayList<>();
        int skipped = 0;
        for (Vouch vouch : pending) {
            if (vouch.sourceUserId.equals(userId)) {
                LOG.warnf("Skipping pending vouch %d: user %d would vouch for themselves as @%s", vouch.id, userId,
                        normalized);
                skipped++;
                continue;
            }
            if (Vouch.findBySourceAndTarget(vouch.sourceUserId, userId).isPresent()) {
                LOG.warnf("Skipping pending vouch %d: user %d already vouched for user %d", vouch.id,
                        vouch.sourceUserId, userId);
                skipped++;
                continue;
            }
            vouch.confirm(userId);
            resolved.add(vouch);
        }

        if (resolved.isEmpty()) {
            return new PendingResolution(userId, List.of(), skipped, null);
        }

        RankChange rankChange = applyVouchDelta(user, resolved.size(), RankEvent.TRIGGER_PENDING_RESOLVED);

        List<Long> resolvedIds = new ArrayList<>();
        for (Vouch vouch : resolved) {
            resolvedIds.add(vouch.id);
            boolean mutual = Vouch.findBySourceAndTarget(userId, vouch.sourceUserId)
                    .filter(reverse -> !reverse.isPending).isPresent();
            if (mutual) {
                eventLog.log(DomainEvent.TYPE_MUTUAL_VOUCH, vouch.sourceUserId, metadata("other_user", userId));
            }
        }

        eventLog.log(DomainEvent.TYPE_PENDING_VOUCHES_PROCESSED, userId, metadata("username", normalized,
                "vouches_processed", resolved.size(), "new_rank", rankChange.newRank().key(), "vouch_ids", resolvedIds));
        metrics.recordPendingResolved(resolved.size());

        LOG.infof("Resolved %d pending vouches for user %d (@%s), total %d -> %d, rank %s", resolved.size(), userId,
                normalized, rankChange.oldTotal(), rankChange.newTotal(), rankChange.newRank().key());

        return new PendingResolution(userId, List.copyOf(resolvedIds), skipped, rankChange);
    }

    /**
     * Replaces the message of a vouch. Totals and ranks are unaffected.
     *
     * @throws ResourceNotFoundException
     *             if the vouch does not exist
     * @throws PermissionDeniedException
     *             if the requester is not the vouch's source
     */
    @Transactional
    public Vouch updateVouch(Long vouchId, Long requestingUserId, String newMessage) {
        Vouch vouch = Vouch.findById(vouchId);
        if (vouch == null) {
            throw new ResourceNotFoundException("Vouch not found: " + vouchId);
        }

        if (!vouch.sourceUserId.equals(requestingUserId)) {
            LOG.warnf("User %s attempted to edit vouch %d owned by user %d", requestingUserId, vouchId,
                    vouch.sourceUserId);
            throw new PermissionDeniedException("Only the author of a vouch can edit it");
        }

        vouch.message = sanitizer.sanitize(newMessage);
        vouch.updatedAt = Instant.now();

        eventLog.log(DomainEvent.TYPE_VOUCH_UPDATED, requestingUserId, metadata("vouch_id", vouchId));
        LOG.infof("Vouch %d message updated by user %d", vouchId, requestingUserId);
        return vouch;
    }

    /**
     * Administrative correction of a user's vouch total.
     *
     * <p>
     * The total is floored at zero. The rank is recomputed through the same path as a received vouch.
     *
     * @param delta
     *            non-zero change to apply
     * @throws InvalidRequestException
     *             if delta is zero or the reason is blank
     * @throws ResourceNotFoundException
     *             if the user does not exist
     */
    @Transactional
    public RankChange adminAdjustVouchCount(Long userId, int delta, String reason, Long adminUserId) {
        if (delta == 0) {
            throw new InvalidRequestException("Delta must be non-zero");
        }
        if (reason == null || reason.isBlank()) {
            throw new InvalidRequestException("Reason is required");
        }

        User user = User.findByIdForUpdate(userId);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }

        RankChange rankChange = applyVouchDelta(user, delta, RankEvent.TRIGGER_ADMIN_ADJUSTMENT);
        eventLog.log(DomainEvent.TYPE_ADMIN_VOUCH_ADJUSTMENT, userId, metadata("delta", delta, "reason", reason,
                "admin_id", adminUserId, "old_total", rankChange.oldTotal(), "new_total", rankChange.newTotal()));

        LOG.infof("Admin %d adjusted vouches for user %d by %+d (%d -> %d): %s", adminUserId, userId, delta,
                rankChange.oldTotal(), rankChange.newTotal(), reason);
        return rankChange;
    }

    /**
     * Persists a rank for a user and records the transition, whether or not the rank actually changed.
     *
     * <p>
     * Used directly for administrative rank corrections; the automatic recompute path only calls it on a change.
     * Must run inside the caller's transaction with the user row already loaded.
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public void recordRankTransition(User user, Rank newRank, String triggerType) {
        String oldRank = user.currentRank;
        user.currentRank = newRank.key();

        RankEvent.create(user.id, oldRank, newRank, user.totalVouches, triggerType);
        eventLog.log(DomainEvent.TYPE_RANK_UP, user.id,
                metadata("old_rank", oldRank, "new_rank", newRank.key(), "trigger", triggerType));
        metrics.recordRankTransition(newRank);

        LOG.infof("Rank transition for user %d: %s -> %s (%s, %d vouches)", user.id, oldRank, newRank.key(),
                triggerType, user.totalVouches);
    }

    @Transactional
    public List<Vouch> vouchesReceived(Long userId) {
        return Vouch.findReceivedBy(userId);
    }

    @Transactional
    public List<Vouch> vouchesGiven(Long userId) {
        return Vouch.findGivenBy(userId);
    }

    @Transactional
    public List<Vouch> recentActivity(int limit) {
        return Vouch.findRecentConfirmed(limit);
    }

    /**
     * The single place a vouch total changes: applies the delta, recalculates the rank and records a transition only
     * when the calculated rank differs from the stored one.
     */
    private RankChange applyVouchDelta(User user, int delta, String triggerType) {
        int oldTotal = user.totalVouches;
        Rank oldRank = user.rank().orElse(null);

        int newTotal;
        try {
            newTotal = Math.max(0, Math.addExact(oldTotal, delta));
        } catch (ArithmeticException e) {
            throw new InvalidRequestException("Vouch total out of range for user " + user.id);
        }
        Rank newRank = rankCalculator.calculate(newTotal);
        user.totalVouches = newTotal;

        RankChange rankChange = new RankChange(user.id, oldTotal, newTotal, oldRank, newRank);
        if (rankChange.changed()) {
            recordRankTransition(user, newRank, triggerType);
        }
        return rankChange;
    }

    private List<User> lockInIdOrder(Long sourceUserId, Long targetUserId) {
        User source;
        User target;
        if (sourceUserId < targetUserId) {
            source = User.findByIdForUpdate(sourceUserId);
            target = User.findByIdForUpdate(targetUserId);
        } else {
            target = User.findByIdForUpdate(targetUserId);
            source = User.findByIdForUpdate(sourceUserId);
        }
        List<User> locked = new ArrayList<>(2);
        locked.add(source);
        locked.add(target);
        return locked;
    }

    private void persistVouch(Vouch vouch) {
        try {
            vouch.persistAndFlush();
        } catch (PersistenceException e) {
            if (!isConstraintViolation(e)) {
                throw e;
            }
            throw reject("duplicate", new DuplicateVouchException("Vouch already exists from user "
                    + vouch.sourceUserId + " to " + (vouch.targetUserId != null ? "user " + vouch.targetUserId
                            : "@" + vouch.targetUsername), e));
        }
    }

    private static boolean isConstraintViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                return true;
            }
        }
        return false;
    }

    private String sanitizeOptional(String message) {
        return message == null ? null : sanitizer.sanitize(message);
    }

    private RuntimeException reject(String reason, RuntimeException failure) {
        metrics.recordRejection(reason);
        LOG.debugf("Vouch rejected (%s): %s", reason, failure.getMessage());
        return failure;
    }
}
