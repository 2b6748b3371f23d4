package com.proxycare.pool.application.health;

import com.proxycare.common.exception.BadRequestException;
import com.proxycare.common.exception.PoolFailureException;
import com.proxycare.common.exception.PoolFailureReason;
import com.proxycare.pool.config.ProxyPoolProperties;
import com.proxycare.pool.domain.proxy.Proxy;
import com.proxycare.pool.domain.stats.ProxyReport;
import com.proxycare.pool.domain.stats.UsageStatistic;
import com.proxycare.pool.domain.status.StatusOutcome;
import com.proxycare.pool.repository.ProxyReportRepository;
import com.proxycare.pool.repository.StatusOutcomeRepository;
import com.proxycare.pool.repository.UsageStatisticRepository;
import com.proxycare.pool.store.ProxyRecordStore;
import com.proxycare.pool.store.StoreGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Records reported outcomes per proxy and applies the {@link BlockingPolicy} after each one.
 */
@Service
public class HealthTracker {

    private static final Logger log = LoggerFactory.getLogger(HealthTracker.class);

    private final ProxyRecordStore store;
    private final StatusOutcomeRepository statusRepository;
    private final UsageStatisticRepository statisticRepository;
    private final ProxyReportRepository reportRepository;
    private final BlockingPolicy blockingPolicy;
    private final StoreGuard guard;
    private final Clock clock;
    private final Duration window;

    public HealthTracker(ProxyRecordStore store,
                         StatusOutcomeRepository statusRepository,
                         UsageStatisticRepository statisticRepository,
                         ProxyReportRepository reportRepository,
                         BlockingPolicy blockingPolicy,
                         StoreGuard guard,
                         Clock clock,
                         ProxyPoolProperties properties) {
        this.store = store;
        this.statusRepository = statusRepository;
        this.statisticRepository = statisticRepository;
        this.reportRepository = reportRepository;
        this.blockingPolicy = blockingPolicy;
        this.guard = guard;
        this.clock = clock;
        this.window = properties.getBlocking().getWindow();
    }

    /**
     * Counts the outcome, logs it, and blocks the proxy if the policy says so.
     * Never unblocks.
     *
     * @throws PoolFailureException with {@code UNKNOWN_STATUS} when the code is not in the catalog
     */
    public ReportOutcome report(Long proxyId, Integer statusCode) {
        if (proxyId == null) throw BadRequestException.forField("proxyId", "is required");
        if (statusCode == null) throw BadRequestException.forField("statusCode", "is required");

        try {
            return guard.execute("report", status -> record(proxyId, statusCode));
        } catch (DataIntegrityViolationException ex) {
            // two first reports for the same (proxy, status) raced on the counter row; the row exists now
            log.debug("Counter row for proxyId={} status={} created concurrently, retrying", proxyId, statusCode);
            return guard.execute("report", status -> record(proxyId, statusCode));
        }
    }

    /**
     * Share of reports with status &gt;= 400 among those received in the last {@code window}.
     */
    public double failureRatio(Long proxyId, Duration window) {
        store.get(proxyId);
        Instant since = now().minus(window);
        return guard.execute("failureRatio", status -> {
            long total = reportRepository.countByProxyIdAndReportedAtGreaterThanEqual(proxyId, since);
            if (total == 0) return 0.0;
            long failures = reportRepository
                    .countByProxyIdAndReportedAtGreaterThanEqualAndStatusCodeGreaterThanEqual(proxyId, since, 400);
            return (double) failures / total;
        });
    }

    public List<StatusCount> statistics(Long proxyId) {
        store.get(proxyId);
        return guard.execute("statistics", status -> {
            List<UsageStatistic> rows = statisticRepository.findByProxyIdOrderByStatusCodeAsc(proxyId);
            Map<Integer, String> descriptions = statusRepository
                    .findAllById(rows.stream().map(UsageStatistic::getStatusCode).toList())
                    .stream()
                    .collect(Collectors.toMap(StatusOutcome::getCode, StatusOutcome::getShortDescription));

            return rows.stream()
                    .map(r -> new StatusCount(r.getStatusCode(), descriptions.get(r.getStatusCode()), r.getCounter()))
                    .toList();
        });
    }

    public Duration getWindow() {
        return window;
    }

    private ReportOutcome record(Long proxyId, Integer statusCode) {
        if (!statusRepository.existsById(statusCode)) {
            log.warn("Rejected report for proxyId={}: unknown status {}", proxyId, statusCode);
            throw new PoolFailureException(
                    "Unknown status code " + statusCode,
                    PoolFailureReason.UNKNOWN_STATUS,
                    Map.of("proxyId", proxyId, "statusCode", statusCode)
            );
        }

        Proxy proxy = store.get(proxyId);
        Instant now = now();

        long counter = incrementCounter(proxyId, statusCode);
        reportRepository.save(ProxyReport.builder()
                .proxyId(proxyId)
                .statusCode(statusCode)
                .reportedAt(now)
                .build());

        OutcomeHistory history = new OutcomeHistory(
                proxyId,
                reportRepository.findStatusCodesSince(proxyId, now.minus(window))
        );
        BlockingDecision decision = blockingPolicy.evaluate(history);

        boolean blockedByReport = false;
        if (decision.block() && !proxy.isBlocked()) {
            store.setBlocked(proxyId, true, now);
            blockedByReport = true;
            log.info("Proxy blocked proxyId={} sourceId={} reason={} lastStatus={} failureRatio={}",
                    proxyId, proxy.getSourceId(), decision.reason(), statusCode,
                    String.format("%.2f", history.failureRatio()));
        }

        return new ReportOutcome(
                proxyId,
                statusCode,
                counter,
                proxy.isBlocked() || blockedByReport,
                blockedByReport,
                decision.reason(),
                history.failureRatio()
        );
    }

    private long incrementCounter(Long proxyId, Integer statusCode) {
        int updated = statisticRepository.incrementCounter(proxyId, statusCode);
        if (updated == 0) {
            statisticRepository.saveAndFlush(UsageStatistic.builder()
                    .proxyId(proxyId)
                    .statusCode(statusCode)
                    .counter(1)
                    .build());
            return 1;
        }
        return statisticRepository.findByProxyIdAndStatusCode(proxyId, statusCode)
                .map(UsageStatistic::getCounter)
                .orElse(1L);
    }

    // timestamp columns keep microseconds
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
