package villagecompute.vouch.api.rest;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.vouch.exceptions.DuplicateVouchException;
import villagecompute.vouch.exceptions.InvalidRequestException;
import villagecompute.vouch.exceptions.PermissionDeniedException;
import villagecompute.vouch.exceptions.RateLimitException;
import villagecompute.vouch.exceptions.ResourceNotFoundException;
import villagecompute.vouch.exceptions.SelfVouchException;

import java.util.Map;

/**
 * Translates service failures into {@code {"error": "..."}} responses.
 *
 * <p>
 * <b>Status mapping:</b>
 * <ul>
 * <li>{@link InvalidRequestException}, {@link SelfVouchException} → 400</li>
 * <li>{@link PermissionDeniedException} → 403</li>
 * <li>{@link ResourceNotFoundException} → 404</li>
 * <li>{@link DuplicateVouchException} → 409</li>
 * <li>{@link RateLimitException} → 429</li>
 * </ul>
 * Anything else is rethrown and surfaces as 500.
 */
public final class ErrorResponses {

    private ErrorResponses() {
        // Utility class
    }

    public static Response error(Response.Status status, String message) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(Map.of("error", message)).build();
    }

    public static Response fromException(RuntimeException e) {
        if (e instanceof InvalidRequestException || e instanceof SelfVouchException) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        }
        if (e instanceof PermissionDeniedException) {
            return error(Response.Status.FORBIDDEN, e.getMessage());
        }
        if (e instanceof ResourceNotFoundException) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
        if (e instanceof DuplicateVouchException) {
            return error(Response.Status.CONFLICT, e.getMessage());
        }
        if (e instanceof RateLimitException) {
            return error(Response.Status.TOO_MANY_REQUESTS, e.getMessage());
        }
        throw e;
    }
}
