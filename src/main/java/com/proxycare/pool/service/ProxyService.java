package com.proxycare.pool.service;

import com.proxycare.common.exception.BadRequestException;
import com.proxycare.common.exception.NotFoundException;
import com.proxycare.pool.config.ProxyPoolProperties;
import com.proxycare.pool.domain.proxy.Proxy;
import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.common.PageResponse;
import com.proxycare.pool.dto.proxy.request.*;
import com.proxycare.pool.dto.proxy.response.ProxyResponse;
import com.proxycare.pool.repository.ProviderRepository;
import com.proxycare.pool.repository.ProxyReportRepository;
import com.proxycare.pool.repository.ProxyRepository;
import com.proxycare.pool.repository.SourceRepository;
import com.proxycare.pool.repository.UsageStatisticRepository;
import com.proxycare.pool.store.ProxyRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Set;

/**
 * Administrative proxy management. Selection and health never go through here.
 */
@Service
public class ProxyService {

    private static final Logger log = LoggerFactory.getLogger(ProxyService.class);

    private static final Set<String> SORTABLE = Set.of("id", "address", "sourceId", "priority", "blocked", "lastTouched");

    private final ProxyRepository proxyRepository;
    private final SourceRepository sourceRepository;
    private final ProviderRepository providerRepository;
    private final UsageStatisticRepository statisticRepository;
    private final ProxyReportRepository reportRepository;
    private final ProxyRecordStore store;
    private final ProxyPoolProperties properties;
    private final Clock clock;

    public ProxyService(ProxyRepository proxyRepository,
                        SourceRepository sourceRepository,
                        ProviderRepository providerRepository,
                        UsageStatisticRepository statisticRepository,
                        ProxyReportRepository reportRepository,
                        ProxyRecordStore store,
                        ProxyPoolProperties properties,
                        Clock clock) {
        this.proxyRepository = proxyRepository;
        this.sourceRepository = sourceRepository;
        this.providerRepository = providerRepository;
        this.statisticRepository = statisticRepository;
        this.reportRepository = reportRepository;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    public PageResponse<ProxyResponse> search(ListProxiesRequest request) {
        if (request == null) request = new ListProxiesRequest();

        Pageable pageable = PageRequests.of(request.getPageNumber(), request.getPageSize(), request.getSort(),
                SORTABLE, Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("id")));

        Long sourceId = request.getSourceId();
        Boolean blocked = request.getBlocked();

        Page<Proxy> page;
        if (sourceId != null && blocked != null) {
            page = proxyRepository.findBySourceIdAndBlocked(sourceId, blocked, pageable);
        } else if (sourceId != null) {
            page = proxyRepository.findBySourceId(sourceId, pageable);
        } else if (blocked != null) {
            page = proxyRepository.findByBlocked(blocked, pageable);
        } else {
            page = proxyRepository.findAll(pageable);
        }

        return PageResponse.of("Proxies loaded", page, this::toResponse);
    }

    @Transactional
    public ApiResponse<ProxyResponse> create(CreateProxyRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }

        String address = requireAddress(request.getAddress());

        Long sourceId = request.getSourceId();
        if (sourceId == null) throw BadRequestException.forField("sourceId", "is required");
        if (!sourceRepository.existsById(sourceId)) {
            throw NotFoundException.of("Source", sourceId);
        }
        requireProviderIfPresent(request.getProviderId());

        Integer usageInterval = request.getUsageInterval();
        if (usageInterval == null) {
            usageInterval = (int) properties.getSelection().getDefaultUsageInterval().toSeconds();
        }
        if (usageInterval < 1) throw BadRequestException.forField("usageInterval", "must be >= 1");

        Proxy saved = proxyRepository.save(Proxy.builder()
                .address(address)
                .sourceId(sourceId)
                .providerId(request.getProviderId())
                .priority(request.getPriority())
                .usageInterval(usageInterval)
                .blocked(Boolean.TRUE.equals(request.getBlocked()))
                .createdAt(clock.instant().truncatedTo(ChronoUnit.MICROS))
                .build());

        log.info("Proxy registered proxyId={} sourceId={} address={}", saved.getId(), sourceId, address);
        return ApiResponse.ok("Proxy created", toResponse(saved));
    }

    /**
     * Partial update of the descriptive fields. The blocked flag and lastTouched are only
     * changed through {@link #setBlocked(SetProxyBlockedRequest)} and the pool itself.
     */
    @Transactional
    public ApiResponse<ProxyResponse> update(Long proxyId, UpdateProxyRequest request) {
        if (proxyId == null) throw BadRequestException.forField("proxyId", "is required");
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }

        Proxy proxy = proxyRepository.findById(proxyId)
                .orElseThrow(() -> NotFoundException.of("Proxy", proxyId));

        if (request.getAddress() != null) {
            proxy.setAddress(requireAddress(request.getAddress()));
        }
        if (request.getProviderId() != null) {
            requireProviderIfPresent(request.getProviderId());
            proxy.setProviderId(request.getProviderId());
        }
        if (request.getPriority() != null) {
            proxy.setPriority(request.getPriority());
        }
        if (request.getUsageInterval() != null) {
            if (request.getUsageInterval() < 1) throw BadRequestException.forField("usageInterval", "must be >= 1");
            proxy.setUsageInterval(request.getUsageInterval());
        }

        return ApiResponse.ok("Proxy updated", toResponse(proxyRepository.save(proxy)));
    }

    public ApiResponse<ProxyResponse> setBlocked(SetProxyBlockedRequest request) {
        if (request == null || request.getProxyId() == null) {
            throw BadRequestException.forField("proxyId", "is required");
        }
        if (request.getBlocked() == null) throw BadRequestException.forField("blocked", "is required");

        Long proxyId = request.getProxyId();
        boolean blocked = request.getBlocked();
        store.setBlocked(proxyId, blocked, clock.instant().truncatedTo(ChronoUnit.MICROS));

        log.info("Proxy {} by operator proxyId={}", blocked ? "blocked" : "unblocked", proxyId);
        return ApiResponse.ok(blocked ? "Proxy blocked" : "Proxy unblocked", toResponse(store.get(proxyId)));
    }

    /**
     * Removes the proxy together with its counters and report log.
     */
    @Transactional
    public ApiResponse<Void> delete(DeleteProxyRequest request) {
        if (request == null || request.getProxyId() == null) {
            throw BadRequestException.forField("proxyId", "is required");
        }

        Long proxyId = request.getProxyId();
        if (!proxyRepository.existsById(proxyId)) {
            throw NotFoundException.of("Proxy", proxyId);
        }

        statisticRepository.deleteByProxyId(proxyId);
        reportRepository.deleteByProxyId(proxyId);
        proxyRepository.deleteById(proxyId);

        log.info("Proxy deleted proxyId={}", proxyId);
        return ApiResponse.ok("Proxy deleted", null);
    }

    private void requireProviderIfPresent(Long providerId) {
        if (providerId != null && !providerRepository.existsById(providerId)) {
            throw NotFoundException.of("Provider", providerId);
        }
    }

    static String requireAddress(String raw) {
        String address = PageRequests.trimToNull(raw);
        if (address == null) throw BadRequestException.forField("address", "is required");
        if (address.length() > 100) throw BadRequestException.forField("address", "must be at most 100 characters");

        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw BadRequestException.forField("address", "must be host:port");
        }

        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException ex) {
            throw BadRequestException.forField("address", "port must be a number");
        }
        if (port < 1 || port > 65535) {
            throw BadRequestException.forField("address", "port must be between 1 and 65535");
        }
        return address;
    }

    private ProxyResponse toResponse(Proxy p) {
        return ProxyResponse.builder()
                .id(p.getId())
                .address(p.getAddress())
                .sourceId(p.getSourceId())
                .providerId(p.getProviderId())
                .priority(p.getPriority())
                .blocked(p.isBlocked())
                .usageInterval((int) p.getUsageCooldown().toSeconds())
                .lastTouched(p.getLastTouched())
                .build();
    }
}
