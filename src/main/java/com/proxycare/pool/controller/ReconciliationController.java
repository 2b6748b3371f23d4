package com.proxycare.pool.controller;

import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.reconcile.request.ReconcileSourceRequest;
import com.proxycare.pool.dto.reconcile.response.ReconcileOutcomeResponse;
import com.proxycare.pool.dto.reconcile.response.ReconciliationTickResponse;
import com.proxycare.pool.service.ReconciliationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @PostMapping("/run")
    public ApiResponse<ReconciliationTickResponse> run() {
        return reconciliationService.runTick();
    }

    @PostMapping("/source")
    public ApiResponse<ReconcileOutcomeResponse> reconcileSource(@Valid @RequestBody ReconcileSourceRequest request) {
        return reconciliationService.reconcileSource(request);
    }
}
