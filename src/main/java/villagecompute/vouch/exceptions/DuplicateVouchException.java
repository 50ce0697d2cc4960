package villagecompute.vouch.exceptions;

/**
 * Exception thrown when a source user already vouched for the same target, either confirmed or still pending under the
 * same username.
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 409 Conflict in REST resources.
 */
public class DuplicateVouchException extends RuntimeException {

    public DuplicateVouchException(String message) {
        super(message);
    }

    public DuplicateVouchException(String message, Throwable cause) {
        super(message, cause);
    }
}
