package com.proxycare.pool.application.reconcile;

import java.time.Instant;
import java.util.List;

/**
 * What one reconciliation tick did across all sources.
 *
 * @param skipped sources whose previous cycle was still running
 * @param failed  sources whose cycle threw; the others were still reconciled
 */
public record ReconciliationTickReport(
        String traceId,
        Instant startedAt,
        List<ReconcileOutcome> outcomes,
        List<Long> skipped,
        List<Long> failed
) {

    public ReconciliationTickReport {
        outcomes = List.copyOf(outcomes);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }

    public int totalUnblocked() {
        return outcomes.stream().mapToInt(ReconcileOutcome::unblocked).sum();
    }

    public long staleSources() {
        return outcomes.stream().filter(ReconcileOutcome::stale).count();
    }
}
