package villagecompute.vouch.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.vouch.data.models.DomainEvent;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only event sink for audit and analytics.
 *
 * <p>
 * {@link #log(String, Long, Map)} joins the caller's transaction, so an event is committed or rolled back together
 * with the state change it describes. Nothing in the service reads events back to make a decision; they are only
 * counted by analytics.
 *
 * @see DomainEvent for the event type constants
 */
@ApplicationScoped
public class EventLogService {

    private static final Logger LOG = Logger.getLogger(EventLogService.class);

    /**
     * Appends an event.
     *
     * @param eventType
     *            one of the {@code DomainEvent.TYPE_*} constants
     * @param userId
     *            user the event is attributed to (optional)
     * @param metadata
     *            structured context (optional, null values allowed)
     * @return persisted event
     */
    @Transactional
    public DomainEvent log(String eventType, Long userId, Map<String, Object> metadata) {
        DomainEvent event = new DomainEvent();
        event.eventType = eventType;
        event.userId = userId;
        event.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        event.createdAt = Instant.now();
        event.persist();

        LOG.debugf("Logged event %s for user %s: %s", eventType, userId, event.metadata);
        return event;
    }

    @Transactional
    public long countByType(String eventType) {
        return DomainEvent.countByType(eventType);
    }

    /**
     * Most recent events attributed to a user, newest first.
     */
    @Transactional
    public List<DomainEvent> recentForUser(Long userId, int limit) {
        return DomainEvent.findRecentByUserId(userId, Math.max(1, limit));
    }

    /**
     * Convenience builder for metadata maps that may hold null values, which {@link Map#of} rejects.
     */
    public static Map<String, Object> metadata(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Metadata requires key/value pairs");
        }
        Map<String, Object> metadata = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            metadata.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return metadata;
    }
}
