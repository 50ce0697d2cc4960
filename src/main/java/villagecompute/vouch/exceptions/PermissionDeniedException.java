package villagecompute.vouch.exceptions;

/**
 * Exception thrown when a caller attempts to mutate something they do not own (e.g., editing another user's vouch) or
 * to use an admin endpoint without being the configured admin.
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 403 Forbidden in REST resources.
 */
public class PermissionDeniedException extends RuntimeException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
