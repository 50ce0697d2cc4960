package villagecompute.vouch.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.vouch.data.models.Rank;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registers and records the vouch ledger's custom metrics.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code vouch_created_total{state}} - Vouches created, state is {@code confirmed} or
 * {@code pending}</li>
 * <li><b>Counters:</b> {@code vouch_rejected_total{reason}} - Rejected vouch attempts ({@code duplicate},
 * {@code self_vouch}, {@code invalid_request}, {@code not_found})</li>
 * <li><b>Counters:</b> {@code vouch_pending_resolved_total} - Pending vouches bound to a user</li>
 * <li><b>Counters:</b> {@code vouch_rank_transitions_total{new_rank}} - Rank changes by destination tier</li>
 * <li><b>Gauges:</b> {@code vouch_last_resolution_batch_size} - Size of the most recent pending resolution</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics} alongside the automatic {@code http_server_*} metrics.
 */
@ApplicationScoped
public class VouchMetrics {

    private static final Logger LOG = Logger.getLogger(VouchMetrics.class);

    @Inject
    MeterRegistry registry;

    private final Map<String, Counter> rejectionCounters = new ConcurrentHashMap<>();

    private final AtomicLong lastResolutionBatchSize = new AtomicLong();

    void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        Gauge.builder("vouch_last_resolution_batch_size", lastResolutionBatchSize, AtomicLong::get)
                .description("Number of pending vouches confirmed by the most recent resolution").register(registry);
        LOG.debug("Registered gauge: vouch_last_resolution_batch_size");
    }

    public void recordVouchCreated(boolean pending) {
        registry.counter("vouch_created_total", "state", pending ? "pending" : "confirmed").increment();
    }

    /**
     * Counts a rejected vouch attempt.
     *
     * @param reason
     *            short machine-readable reason, used as the tag value
     */
    public void recordRejection(String reason) {
        rejectionCounters.computeIfAbsent(reason,
                r -> Counter.builder("vouch_rejected_total").description("Rejected vouch attempts by reason")
                        .tag("reason", r).register(registry))
                .increment();
    }

    public void recordPendingResolved(int count) {
        lastResolutionBatchSize.set(count);
        if (count > 0) {
            registry.counter("vouch_pending_resolved_total").increment(count);
        }
    }

    public void recordRankTransition(Rank newRank) {
        registry.counter("vouch_rank_transitions_total", "new_rank", newRank.key()).increment();
    }
}
