package villagecompute.vouch.exceptions;

/**
 * Exception thrown when a user attempts to vouch for themselves, by id or by their own username.
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 400 Bad Request in REST resources.
 */
public class SelfVouchException extends RuntimeException {

    public SelfVouchException(String message) {
        super(message);
    }

    public SelfVouchException(String message, Throwable cause) {
        super(message, cause);
    }
}
