package com.proxycare.pool.application.reconcile;

import com.proxycare.pool.store.ProxyRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs {@link StalenessReconciler} for every source on a fixed delay.
 * <p>
 * Sources are reconciled in parallel on a bounded executor since their rows are disjoint.
 * The only state kept is which sources have a cycle in flight, so a slow source is skipped
 * by the next tick instead of being reconciled twice at once.
 */
@Component
public class ReconciliationTaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationTaskScheduler.class);
    private static final String TRACE_ID = "traceId";

    private final ProxyRecordStore store;
    private final StalenessReconciler reconciler;
    private final TaskExecutor executor;
    private final Clock clock;

    private final Set<Long> running = ConcurrentHashMap.newKeySet();

    public ReconciliationTaskScheduler(ProxyRecordStore store,
                                       StalenessReconciler reconciler,
                                       @Qualifier("reconciliationExecutor") TaskExecutor executor,
                                       Clock clock) {
        this.store = store;
        this.reconciler = reconciler;
        this.executor = executor;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${proxypool.reconciliation.interval:PT3M}",
            initialDelayString = "${proxypool.reconciliation.initial-delay:PT30S}"
    )
    public void scheduledTick() {
        try {
            runReconciliationTick();
        } catch (RuntimeException ex) {
            log.warn("Reconciliation tick failed, next tick runs on schedule", ex);
        }
    }

    /**
     * One pass over all sources. Returns once every submitted cycle has finished.
     */
    public ReconciliationTickReport runReconciliationTick() {
        String traceId = UUID.randomUUID().toString();
        MDC.put(TRACE_ID, traceId);
        try {
            Instant startedAt = clock.instant();
            Duration staleAfter = reconciler.getStaleAfter();

            Map<Long, CompletableFuture<ReconcileOutcome>> inFlight = new LinkedHashMap<>();
            List<Long> skipped = new ArrayList<>();
            for (Long sourceId : store.sourceIds()) {
                if (!running.add(sourceId)) {
                    skipped.add(sourceId);
                    continue;
                }
                try {
                    inFlight.put(sourceId, CompletableFuture.supplyAsync(
                            () -> reconcileOne(sourceId, startedAt, staleAfter, traceId), executor));
                } catch (RejectedExecutionException ex) {
                    running.remove(sourceId);
                    skipped.add(sourceId);
                    log.warn("Reconciliation of sourceId={} rejected by executor", sourceId);
                }
            }

            List<ReconcileOutcome> outcomes = new ArrayList<>();
            List<Long> failed = new ArrayList<>();
            inFlight.forEach((sourceId, future) -> {
                try {
                    outcomes.add(future.join());
                } catch (CompletionException ex) {
                    failed.add(sourceId);
                    log.warn("Reconciliation of sourceId={} failed", sourceId, ex.getCause());
                }
            });

            ReconciliationTickReport report = new ReconciliationTickReport(traceId, startedAt, outcomes, skipped, failed);
            log.info("Reconciliation tick done sources={} stale={} unblocked={} skipped={} failed={}",
                    outcomes.size() + failed.size(), report.staleSources(), report.totalUnblocked(),
                    skipped.size(), failed.size());
            return report;
        } finally {
            MDC.remove(TRACE_ID);
        }
    }

    public boolean isRunning(Long sourceId) {
        return running.contains(sourceId);
    }

    private ReconcileOutcome reconcileOne(Long sourceId, Instant now, Duration staleAfter, String traceId) {
        String previous = MDC.get(TRACE_ID);
        MDC.put(TRACE_ID, traceId);
        try {
            return reconciler.reconcileSource(sourceId, now, staleAfter);
        } finally {
            running.remove(sourceId);
            if (previous == null) MDC.remove(TRACE_ID);
            else MDC.put(TRACE_ID, previous);
        }
    }
}
