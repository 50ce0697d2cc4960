package villagecompute.vouch.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.vouch.data.models.DomainEvent;
import villagecompute.vouch.data.models.Invite;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.RateLimitException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.util.UsernameNormalizer;

import java.time.Duration;
import java.time.Instant;

import static villagecompute.vouch.services.EventLogService.metadata;

/**
 * Records invitations to not-yet-joined usernames and enforces the per-target cooldown.
 *
 * <p>
 * A user may invite a given username once per {@code vouch.invites.cooldown-days} (7 by default). No message is
 * delivered; the invite is only recorded.
 */
@ApplicationScoped
public class InviteService {

    private static final Logger LOG = Logger.getLogger(InviteService.class);

    @Inject
    EventLogService eventLog;

    @ConfigProperty(
            name = "vouch.invites.cooldown-days",
            defaultValue = "7")
    int cooldownDays;

    /**
     * Returns true when no invite from this user to this username falls inside the cooldown window.
     */
    @Transactional
    public boolean canSendInvite(Long sourceUserId, String targetUsername) {
        String normalized = UsernameNormalizer.normalize(targetUsername);
        if (normalized == null) {
            return false;
        }
        return Invite.findLatestSince(sourceUserId, normalized, cooldownStart()).isEmpty();
    }

    /**
     * Records an invite.
     *
     * @throws InvalidRequestException
     *             if the username is blank
     * @throws ResourceNotFoundException
     *             if the inviting user does not exist
     * @throws RateLimitException
     *             if the same username was invited by this user within the cooldown
     */
    @Transactional
    public Invite sendInvite(Long sourceUserId, String targetUsername) {
        String normalized = UsernameNormalizer.normalize(targetUsername);
        if (normalized == null) {
            throw new InvalidRequestException("A username to invite is required");
        }

        User source = User.findByIdForUpdate(sourceUserId);
        if (source == null) {
            throw new ResourceNotFoundException("User not found: " + sourceUserId);
        }

        if (Invite.findLatestSince(sourceUserId, normalized, cooldownStart()).isPresent()) {
            LOG.debugf("Invite from user %d to @%s blocked by cooldown", sourceUserId, normalized);
            throw new RateLimitException(
                    "You can only invite @" + normalized + " once every " + cooldownDays + " days");
        }

        Invite invite = Invite.create(sourceUserId, normalized);
        eventLog.log(DomainEvent.TYPE_INVITE_LOGGED, sourceUserId, metadata("to_username", normalized));

        LOG.infof("User %d invited @%s", sourceUserId, normalized);
        return invite;
    }

    private Instant cooldownStart() {
        return Instant.now().minus(Duration.ofDays(cooldownDays));
    }
}
