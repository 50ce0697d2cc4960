package villagecompute.vouch.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching log lines with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code user_id} - Platform user the request acts for (absent for admin and anonymous reads)</li>
 * <li>{@code request_origin} - HTTP method and path, e.g. {@code POST /api/vouches}</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Each request must clear
 * MDC when it finishes to prevent context leaking into the next request on the same worker thread.
 *
 * @see villagecompute.vouch.api.filters.LoggingEnricher for automatic HTTP request enrichment
 */
public final class LoggingConfig {

    /** OpenTelemetry trace identifier (hexadecimal string, 32 characters). */
    public static final String MDC_TRACE_ID = "trace_id";

    /** OpenTelemetry span identifier (hexadecimal string, 16 characters). */
    public static final String MDC_SPAN_ID = "span_id";

    /** Platform user id (Long as String). */
    public static final String MDC_USER_ID = "user_id";

    /** HTTP method and request path. */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into MDC.
     *
     * <p>
     * If no span is active (tracing disabled or outside a request) the fields are set to empty strings so the log
     * format stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets the acting platform user in MDC.
     *
     * @param userId
     *            platform user id, ignored when null
     */
    public static void setUserId(Long userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId.toString());
        }
    }

    /**
     * Sets the request origin.
     *
     * @param requestOrigin
     *            e.g. {@code "GET /api/users/42/profile"}
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Removes every field this class manages.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
