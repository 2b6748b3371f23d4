package com.proxycare.pool.service;

import com.proxycare.common.exception.BadRequestException;
import com.proxycare.common.exception.NotFoundException;
import com.proxycare.pool.application.health.HealthTracker;
import com.proxycare.pool.application.health.ReportOutcome;
import com.proxycare.pool.application.reconcile.ReconciliationTaskScheduler;
import com.proxycare.pool.application.selection.ProxyHandle;
import com.proxycare.pool.application.selection.SelectionEngine;
import com.proxycare.pool.domain.proxy.Proxy;
import com.proxycare.pool.domain.source.Source;
import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.pool.request.AcquireProxyRequest;
import com.proxycare.pool.dto.pool.request.PoolSummaryRequest;
import com.proxycare.pool.dto.pool.request.ReportOutcomeRequest;
import com.proxycare.pool.dto.pool.response.PoolSummaryResponse;
import com.proxycare.pool.dto.pool.response.ProxyHandleResponse;
import com.proxycare.pool.dto.pool.response.ProxyHealthResponse;
import com.proxycare.pool.dto.pool.response.ReportOutcomeResponse;
import com.proxycare.pool.repository.ProxyRepository;
import com.proxycare.pool.repository.SourceRepository;
import com.proxycare.pool.store.ProxyRecordStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Request-facing side of the pool: hands out proxies, takes outcome reports, and answers
 * "what does this source look like right now".
 */
@Service
public class ProxyPoolService {

    private final SelectionEngine selectionEngine;
    private final HealthTracker healthTracker;
    private final ProxyRecordStore store;
    private final SourceRepository sourceRepository;
    private final ProxyRepository proxyRepository;
    private final ReconciliationTaskScheduler scheduler;
    private final Clock clock;

    public ProxyPoolService(SelectionEngine selectionEngine,
                            HealthTracker healthTracker,
                            ProxyRecordStore store,
                            SourceRepository sourceRepository,
                            ProxyRepository proxyRepository,
                            ReconciliationTaskScheduler scheduler,
                            Clock clock) {
        this.selectionEngine = selectionEngine;
        this.healthTracker = healthTracker;
        this.store = store;
        this.sourceRepository = sourceRepository;
        this.proxyRepository = proxyRepository;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public ApiResponse<ProxyHandleResponse> acquire(AcquireProxyRequest request) {
        if (request == null || request.getSourceId() == null) {
            throw BadRequestException.forField("sourceId", "is required");
        }

        ProxyHandle handle = selectionEngine.acquire(request.getSourceId());
        return ApiResponse.ok("Proxy assigned", toResponse(handle));
    }

    public ApiResponse<ReportOutcomeResponse> report(ReportOutcomeRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }

        ReportOutcome outcome = healthTracker.report(request.getProxyId(), request.getStatusCode());
        String message = outcome.blockedByReport() ? "Report recorded, proxy blocked" : "Report recorded";

        return ApiResponse.ok(message, ReportOutcomeResponse.builder()
                .proxyId(outcome.proxyId())
                .statusCode(outcome.statusCode())
                .counter(outcome.counter())
                .blocked(outcome.blocked())
                .blockedByReport(outcome.blockedByReport())
                .reason(outcome.reason().name())
                .failureRatio(outcome.failureRatio())
                .build());
    }

    public ApiResponse<PoolSummaryResponse> summary(PoolSummaryRequest request) {
        if (request == null || request.getSourceId() == null) {
            throw BadRequestException.forField("sourceId", "is required");
        }

        Long sourceId = request.getSourceId();
        Source source = sourceRepository.findById(sourceId)
                .orElseThrow(() -> NotFoundException.of("Source", sourceId));

        long total = proxyRepository.countBySourceId(sourceId);
        long blocked = proxyRepository.countBySourceIdAndBlockedTrue(sourceId);

        Instant now = clock.instant();
        List<Proxy> eligible = store.listEligible(sourceId);
        long available = eligible.stream().filter(p -> !p.isCoolingDown(now)).count();

        return ApiResponse.ok("Pool summary loaded", PoolSummaryResponse.builder()
                .sourceId(sourceId)
                .sourceName(source.getName())
                .total(total)
                .blocked(blocked)
                .unblocked(total - blocked)
                .available(available)
                .mostRecentTouch(store.mostRecentTouch(sourceId).orElse(null))
                .reconciling(scheduler.isRunning(sourceId))
                .build());
    }

    /**
     * @param window ISO-8601 duration such as {@code PT10M}; the blocking window when blank
     */
    public ApiResponse<ProxyHealthResponse> health(Long proxyId, String window) {
        if (proxyId == null) throw BadRequestException.forField("proxyId", "is required");

        Duration w = parseWindow(window);
        Proxy proxy = store.get(proxyId);

        List<ProxyHealthResponse.StatusCountResponse> statistics = healthTracker.statistics(proxyId).stream()
                .map(c -> ProxyHealthResponse.StatusCountResponse.builder()
                        .statusCode(c.statusCode())
                        .description(c.description())
                        .counter(c.counter())
                        .build())
                .toList();

        return ApiResponse.ok("Proxy health loaded", ProxyHealthResponse.builder()
                .proxyId(proxyId)
                .blocked(proxy.isBlocked())
                .window(w.toString())
                .failureRatio(healthTracker.failureRatio(proxyId, w))
                .statistics(statistics)
                .build());
    }

    private Duration parseWindow(String window) {
        String s = PageRequests.trimToNull(window);
        if (s == null) return healthTracker.getWindow();

        Duration d;
        try {
            d = Duration.parse(s);
        } catch (DateTimeParseException ex) {
            throw BadRequestException.forField("window", "must be an ISO-8601 duration like PT10M");
        }
        if (d.isNegative() || d.isZero()) {
            throw BadRequestException.forField("window", "must be positive");
        }
        return d;
    }

    private ProxyHandleResponse toResponse(ProxyHandle h) {
        return ProxyHandleResponse.builder()
                .proxyId(h.proxyId())
                .address(h.address())
                .sourceId(h.sourceId())
                .providerId(h.providerId())
                .priority(h.priority())
                .usageIntervalSeconds(h.usageCooldown().toSeconds())
                .assignedAt(h.assignedAt())
                .reusableAt(h.reusableAt())
                .build();
    }
}
