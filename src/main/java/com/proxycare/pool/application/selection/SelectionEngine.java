package com.proxycare.pool.application.selection;

import com.proxycare.common.exception.ConflictException;
import com.proxycare.common.exception.NotFoundException;
import com.proxycare.common.exception.PoolFailureException;
import com.proxycare.common.exception.PoolFailureReason;
import com.proxycare.pool.domain.proxy.Proxy;
import com.proxycare.pool.store.ProxyRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out the best usable proxy of a source.
 * <p>
 * Candidates are tried in priority order (highest first, lowest id on ties). Each attempt is a
 * compare-and-set in the store, so concurrent callers never receive the same proxy inside its
 * cooldown; a lost race just moves on to the next candidate. The scan is bounded and never waits.
 */
@Service
public class SelectionEngine {

    private static final Logger log = LoggerFactory.getLogger(SelectionEngine.class);

    private final ProxyRecordStore store;
    private final Clock clock;

    public SelectionEngine(ProxyRecordStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @throws NotFoundException    when the source does not exist
     * @throws PoolFailureException with {@code EXHAUSTED} when every unblocked proxy is cooling down,
     *                              or the source has none
     */
    public ProxyHandle acquire(Long sourceId) {
        if (!store.sourceExists(sourceId)) {
            throw NotFoundException.of("Source", sourceId);
        }

        List<Proxy> candidates = store.listEligible(sourceId);
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);

        int coolingDown = 0;
        int lostRaces = 0;
        for (Proxy candidate : candidates) {
            // lastTouched only moves forward, so a snapshot that says "cooling" is never wrong
            if (candidate.isCoolingDown(now)) {
                coolingDown++;
                continue;
            }
            try {
                store.markAssigned(candidate.getId(), now);
                return ProxyHandle.of(candidate, now);
            } catch (ConflictException ex) {
                lostRaces++;
                log.debug("Skipping proxyId={} for sourceId={}: {}", candidate.getId(), sourceId, ex.getMessage());
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sourceId", sourceId);
        details.put("eligible", candidates.size());
        details.put("coolingDown", coolingDown);
        details.put("conflicts", lostRaces);
        throw new PoolFailureException("No usable proxy for source " + sourceId, PoolFailureReason.EXHAUSTED, details);
    }
}
