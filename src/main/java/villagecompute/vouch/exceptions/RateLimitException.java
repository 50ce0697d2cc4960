package villagecompute.vouch.exceptions;

/**
 * Exception thrown when an action is repeated inside its cooldown window (e.g., inviting the same username twice within
 * seven days).
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class RateLimitException extends RuntimeException {

    public RateLimitException(String message) {
        super(message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
