package com.proxycare.pool.store;

import com.proxycare.common.exception.PoolFailureException;
import com.proxycare.common.exception.PoolFailureReason;
import com.proxycare.pool.application.selection.SelectionEngine;
import com.proxycare.pool.domain.proxy.Proxy;
import com.proxycare.pool.domain.source.Source;
import com.proxycare.pool.repository.ProxyRepository;
import com.proxycare.pool.repository.SourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Same race as the in-memory selection test, but the compare-and-set runs as real
 * conditional updates against H2 from separate connections.
 */
@DataJpaTest
@Import({JpaProxyRecordStore.class, StoreGuard.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaProxyRecordStoreConcurrencyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final int PROXIES = 5;
    private static final int CALLERS = 24;

    @Autowired
    private JpaProxyRecordStore store;

    @Autowired
    private ProxyRepository proxyRepository;

    @Autowired
    private SourceRepository sourceRepository;

    private Long sourceId;

    @BeforeEach
    void setUp() {
        proxyRepository.deleteAll();
        sourceRepository.deleteAll();
        sourceId = sourceRepository.save(Source.builder().name("race").build()).getId();
        for (int i = 0; i < PROXIES; i++) {
            proxyRepository.save(Proxy.builder()
                    .address("172.16.0." + i + ":3128")
                    .sourceId(sourceId)
                    .priority(50)
                    .blocked(false)
                    .usageInterval(60)
                    .createdAt(NOW.minusSeconds(3600))
                    .build());
        }
    }

    @Test
    @DisplayName("racing callers on one source get distinct proxies, the rest are told the pool is exhausted")
    void racingCallersGetDistinctProxies() throws Exception {
        SelectionEngine engine = new SelectionEngine(store, Clock.fixed(NOW, ZoneOffset.UTC));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> futures = new ArrayList<>();
        for (int i = 0; i < CALLERS; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    return engine.acquire(sourceId).proxyId();
                } catch (PoolFailureException ex) {
                    assertEquals(PoolFailureReason.EXHAUSTED, ex.getReason());
                    return null;
                }
            }));
        }
        start.countDown();

        Set<Long> assigned = new HashSet<>();
        int exhausted = 0;
        try {
            for (Future<Long> f : futures) {
                Long id = f.get(30, TimeUnit.SECONDS);
                if (id == null) {
                    exhausted++;
                } else {
                    assertTrue(assigned.add(id), "proxy " + id + " handed out twice");
                }
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(PROXIES, assigned.size());
        assertEquals(CALLERS - PROXIES, exhausted);
        for (Long id : assigned) {
            assertEquals(NOW, store.get(id).getLastTouched());
        }
    }
}
