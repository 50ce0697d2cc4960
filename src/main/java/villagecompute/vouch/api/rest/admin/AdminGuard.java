package villagecompute.vouch.api.rest.admin;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.vouch.exceptions.PermissionDeniedException;

/**
 * Single-admin check for {@code /admin/api} endpoints.
 *
 * <p>
 * Callers pass their platform id as {@code admin_id}; it must equal {@code vouch.admin-user-id}. An unset admin id (0)
 * locks every admin endpoint.
 */
@ApplicationScoped
public class AdminGuard {

    private static final Logger LOG = Logger.getLogger(AdminGuard.class);

    @ConfigProperty(
            name = "vouch.admin-user-id",
            defaultValue = "0")
    long adminUserId;

    public boolean isAdmin(Long userId) {
        return adminUserId != 0 && userId != null && userId.longValue() == adminUserId;
    }

    /**
     * @throws PermissionDeniedException
     *             if the caller is not the configured admin
     */
    public void requireAdmin(Long userId) {
        if (!isAdmin(userId)) {
            LOG.warnf("Rejected admin request from user %s", userId);
            throw new PermissionDeniedException("Unauthorized");
        }
    }
}
