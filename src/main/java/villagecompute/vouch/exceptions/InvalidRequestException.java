package villagecompute.vouch.exceptions;

/**
 * Exception thrown when a request is malformed or ambiguous (e.g., a vouch with neither target id nor username, an
 * unknown rank key, a zero adjustment).
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 400 Bad Request in REST resources.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
