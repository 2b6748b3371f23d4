package com.proxycare.pool.application.reconcile;

import com.proxycare.pool.config.ProxyPoolProperties;
import com.proxycare.pool.store.ProxyRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Gives a stalled source a fresh start.
 * <p>
 * When no proxy of a source has been assigned, blocked or created for longer than
 * {@code staleAfter}, traffic for it has most likely stopped because everything got blocked;
 * every proxy of the source is unblocked. The store re-checks the cutoff inside the unblock, so
 * a proxy blocked after the staleness read leaves the source untouched. Running it twice in a row has the same effect as running it once.
 */
@Service
public class StalenessReconciler {

    private static final Logger log = LoggerFactory.getLogger(StalenessReconciler.class);

    private final ProxyRecordStore store;
    private final Clock clock;
    private final Duration staleAfter;

    public StalenessReconciler(ProxyRecordStore store, Clock clock, ProxyPoolProperties properties) {
        this.store = store;
        this.clock = clock;
        this.staleAfter = properties.getReconciliation().getStaleAfter();
    }

    public ReconcileOutcome reconcileSource(Long sourceId) {
        return reconcileSource(sourceId, clock.instant(), staleAfter);
    }

    public ReconcileOutcome reconcileSource(Long sourceId, Instant now, Duration staleAfter) {
        Optional<Instant> latest = store.mostRecentTouch(sourceId);
        if (latest.isEmpty()) {
            return ReconcileOutcome.fresh(sourceId, null);
        }

        Duration idle = Duration.between(latest.get(), now);
        if (idle.compareTo(staleAfter) <= 0) {
            return ReconcileOutcome.fresh(sourceId, latest.get());
        }

        int unblocked = store.unblockAllForSource(sourceId, now.minus(staleAfter));
        if (unblocked > 0) {
            log.info("Stale source rescued sourceId={} idleSeconds={} unblocked={}",
                    sourceId, idle.toSeconds(), unblocked);
        }
        return new ReconcileOutcome(sourceId, latest.get(), true, unblocked);
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }
}
