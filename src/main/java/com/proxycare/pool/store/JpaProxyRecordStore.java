package com.proxycare.pool.store;

import com.proxycare.common.exception.ConflictException;
import com.proxycare.common.exception.NotFoundException;
import com.proxycare.pool.domain.proxy.Proxy;
import com.proxycare.pool.repository.ProxyRepository;
import com.proxycare.pool.repository.SourceRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class JpaProxyRecordStore implements ProxyRecordStore {

    private final ProxyRepository proxyRepository;
    private final SourceRepository sourceRepository;
    private final StoreGuard guard;

    public JpaProxyRecordStore(ProxyRepository proxyRepository, SourceRepository sourceRepository, StoreGuard guard) {
        this.proxyRepository = proxyRepository;
        this.sourceRepository = sourceRepository;
        this.guard = guard;
    }

    @Override
    public Proxy get(Long proxyId) {
        return guard.execute("get", status -> proxyRepository.findById(proxyId)
                .orElseThrow(() -> NotFoundException.of("Proxy", proxyId)));
    }

    @Override
    public boolean sourceExists(Long sourceId) {
        return guard.execute("sourceExists", status -> sourceRepository.existsById(sourceId));
    }

    @Override
    public List<Long> sourceIds() {
        return guard.execute("sourceIds", status -> sourceRepository.findAllIds());
    }

    @Override
    public List<Proxy> listEligible(Long sourceId) {
        return guard.execute("listEligible",
                status -> proxyRepository.findBySourceIdAndBlockedFalseOrderByPriorityDescIdAsc(sourceId));
    }

    @Override
    public void markAssigned(Long proxyId, Instant now) {
        guard.run("markAssigned", () -> {
            Proxy current = proxyRepository.findById(proxyId)
                    .orElseThrow(() -> NotFoundException.of("Proxy", proxyId));

            if (current.isBlocked()) {
                throw conflict("Proxy is blocked", current);
            }
            if (current.isCoolingDown(now)) {
                throw conflict("Proxy is cooling down", current);
            }

            Instant expected = current.getLastTouched();
            int updated = (expected == null)
                    ? proxyRepository.markAssignedIfUntouched(proxyId, now)
                    : proxyRepository.markAssignedIfTouchedAt(proxyId, expected, now);

            if (updated == 0) {
                throw conflict("Proxy was assigned concurrently", current);
            }
        });
    }

    @Override
    public void setBlocked(Long proxyId, boolean blocked, Instant now) {
        guard.run("setBlocked", () -> {
            int updated = proxyRepository.updateBlocked(proxyId, blocked, now);
            if (updated == 0) {
                throw NotFoundException.of("Proxy", proxyId);
            }
        });
    }

    @Override
    public int unblockAllForSource(Long sourceId, Instant cutoff) {
        return guard.execute("unblockAllForSource",
                status -> proxyRepository.unblockAllIfIdleSince(sourceId, cutoff));
    }

    @Override
    public Optional<Instant> mostRecentTouch(Long sourceId) {
        return guard.execute("mostRecentTouch", status -> proxyRepository.findMostRecentTouch(sourceId));
    }

    private static ConflictException conflict(String message, Proxy proxy) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("proxyId", proxy.getId());
        details.put("lastTouched", proxy.getLastTouched());
        details.put("usageInterval", proxy.getUsageInterval());
        return new ConflictException(message, details);
    }
}
