package com.proxycare.pool.application.reconcile;

import java.time.Instant;

/**
 * @param mostRecentTouch latest activity across the source, null when it has no proxies
 * @param unblocked       proxies unblocked by this cycle
 */
public record ReconcileOutcome(Long sourceId, Instant mostRecentTouch, boolean stale, int unblocked) {

    public static ReconcileOutcome fresh(Long sourceId, Instant mostRecentTouch) {
        return new ReconcileOutcome(sourceId, mostRecentTouch, false, 0);
    }
}
