package com.proxycare.pool.controller;

import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.pool.request.AcquireProxyRequest;
import com.proxycare.pool.dto.pool.request.PoolSummaryRequest;
import com.proxycare.pool.dto.pool.request.ReportOutcomeRequest;
import com.proxycare.pool.dto.pool.response.PoolSummaryResponse;
import com.proxycare.pool.dto.pool.response.ProxyHandleResponse;
import com.proxycare.pool.dto.pool.response.ReportOutcomeResponse;
import com.proxycare.pool.service.ProxyPoolService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/pool")
public class ProxyPoolController {

    private final ProxyPoolService proxyPoolService;

    public ProxyPoolController(ProxyPoolService proxyPoolService) {
        this.proxyPoolService = proxyPoolService;
    }

    @PostMapping("/acquire")
    public ApiResponse<ProxyHandleResponse> acquire(@Valid @RequestBody AcquireProxyRequest request) {
        return proxyPoolService.acquire(request);
    }

    @PostMapping("/report")
    public ApiResponse<ReportOutcomeResponse> report(@Valid @RequestBody ReportOutcomeRequest request) {
        return proxyPoolService.report(request);
    }

    @PostMapping("/summary")
    public ApiResponse<PoolSummaryResponse> summary(@Valid @RequestBody PoolSummaryRequest request) {
        return proxyPoolService.summary(request);
    }
}
