package com.proxycare.pool.service;

import com.proxycare.common.exception.BadRequestException;
import com.proxycare.common.exception.NotFoundException;
import com.proxycare.pool.application.reconcile.ReconcileOutcome;
import com.proxycare.pool.application.reconcile.ReconciliationTaskScheduler;
import com.proxycare.pool.application.reconcile.ReconciliationTickReport;
import com.proxycare.pool.application.reconcile.StalenessReconciler;
import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.reconcile.request.ReconcileSourceRequest;
import com.proxycare.pool.dto.reconcile.response.ReconcileOutcomeResponse;
import com.proxycare.pool.dto.reconcile.response.ReconciliationTickResponse;
import com.proxycare.pool.store.ProxyRecordStore;
import org.springframework.stereotype.Service;

/**
 * Manual triggers for the reconciliation normally driven by the scheduler.
 */
@Service
public class ReconciliationService {

    private final ReconciliationTaskScheduler scheduler;
    private final StalenessReconciler reconciler;
    private final ProxyRecordStore store;

    public ReconciliationService(ReconciliationTaskScheduler scheduler,
                                 StalenessReconciler reconciler,
                                 ProxyRecordStore store) {
        this.scheduler = scheduler;
        this.reconciler = reconciler;
        this.store = store;
    }

    public ApiResponse<ReconciliationTickResponse> runTick() {
        ReconciliationTickReport report = scheduler.runReconciliationTick();

        return ApiResponse.ok("Reconciliation tick completed", ReconciliationTickResponse.builder()
                .traceId(report.traceId())
                .startedAt(report.startedAt())
                .totalUnblocked(report.totalUnblocked())
                .outcomes(report.outcomes().stream().map(this::toResponse).toList())
                .skipped(report.skipped())
                .failed(report.failed())
                .build());
    }

    public ApiResponse<ReconcileOutcomeResponse> reconcileSource(ReconcileSourceRequest request) {
        if (request == null || request.getSourceId() == null) {
            throw BadRequestException.forField("sourceId", "is required");
        }

        Long sourceId = request.getSourceId();
        if (!store.sourceExists(sourceId)) {
            throw NotFoundException.of("Source", sourceId);
        }

        ReconcileOutcome outcome = reconciler.reconcileSource(sourceId);
        String message = outcome.stale() ? "Source was stale and has been reset" : "Source is fresh";
        return ApiResponse.ok(message, toResponse(outcome));
    }

    private ReconcileOutcomeResponse toResponse(ReconcileOutcome o) {
        return ReconcileOutcomeResponse.builder()
                .sourceId(o.sourceId())
                .mostRecentTouch(o.mostRecentTouch())
                .stale(o.stale())
                .unblocked(o.unblocked())
                .build();
    }
}
