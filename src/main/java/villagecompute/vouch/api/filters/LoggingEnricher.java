package villagecompute.vouch.api.filters;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import villagecompute.vouch.observability.LoggingConfig;

/**
 * Fills the MDC for every HTTP request and clears it when the response is written.
 *
 * <p>
 * Sets trace context and request origin ({@code METHOD /path}). When the request carries a {@code user_id} query
 * parameter or path segment (e.g. {@code /api/users/42/profile}) it is recorded as {@code user_id}.
 */
@Provider
public class LoggingEnricher implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(LoggingEnricher.class);

    @Override
    public void filter(ContainerRequestContext requestContext) {
        LoggingConfig.enrichWithTraceContext();

        String path = requestContext.getUriInfo().getPath();
        LoggingConfig.setRequestOrigin(requestContext.getMethod() + " " + path);
        LoggingConfig.setUserId(parseUserId(requestContext.getUriInfo().getQueryParameters().getFirst("user_id")));
        LoggingConfig.setUserId(parseUserId(requestContext.getUriInfo().getPathParameters().getFirst("userId")));
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (responseContext.getStatus() >= 500) {
            LOG.warnf("Request failed with status %d", responseContext.getStatus());
        }
        LoggingConfig.clearMDC();
    }

    private static Long parseUserId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring non-numeric user id %s in request", value);
            return null;
        }
    }
}
