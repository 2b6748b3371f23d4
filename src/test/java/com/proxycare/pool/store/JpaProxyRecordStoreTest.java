package com.proxycare.pool.store;

import com.proxycare.common.exception.ConflictException;
import com.proxycare.common.exception.NotFoundException;
import com.proxycare.pool.domain.proxy.Proxy;
import com.proxycare.pool.domain.source.Source;
import com.proxycare.pool.repository.ProxyRepository;
import com.proxycare.pool.repository.SourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.IntSupplier;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({JpaProxyRecordStore.class, StoreGuard.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaProxyRecordStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final Instant CREATED = T0.minusSeconds(3600);
    private static final Instant CUTOFF = T0.minusSeconds(300);

    @Autowired
    private JpaProxyRecordStore store;

    @Autowired
    private StoreGuard guard;

    @Autowired
    private ProxyRepository proxyRepository;

    @Autowired
    private SourceRepository sourceRepository;

    private Long sourceA;
    private Long sourceB;

    @BeforeEach
    void setUp() {
        proxyRepository.deleteAll();
        sourceRepository.deleteAll();
        sourceA = sourceRepository.save(Source.builder().name("alpha").build()).getId();
        sourceB = sourceRepository.save(Source.builder().name("beta").build()).getId();
    }

    private Proxy proxy(Long sourceId, int priority, boolean blocked, Instant lastTouched) {
        return proxy(sourceId, priority, blocked, lastTouched, CREATED);
    }

    private Proxy proxy(Long sourceId, int priority, boolean blocked, Instant lastTouched, Instant createdAt) {
        return proxyRepository.save(Proxy.builder()
                .address("192.168.1." + priority + ":3128")
                .sourceId(sourceId)
                .priority(priority)
                .blocked(blocked)
                .usageInterval(30)
                .lastTouched(lastTouched)
                .createdAt(createdAt)
                .build());
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("eligible proxies are unblocked, by priority desc then id asc")
        void listEligibleOrder() {
            Proxy low = proxy(sourceA, 10, false, null);
            Proxy high = proxy(sourceA, 90, false, null);
            Proxy tie = proxy(sourceA, 10, false, null);
            proxy(sourceA, 99, true, null);
            proxy(sourceB, 100, false, null);

            List<Long> ids = store.listEligible(sourceA).stream().map(Proxy::getId).toList();

            assertEquals(List.of(high.getId(), low.getId(), tie.getId()), ids);
        }

        @Test
        @DisplayName("latest activity falls back to creation time for never touched proxies")
        void mostRecentTouch() {
            assertEquals(Optional.empty(), store.mostRecentTouch(sourceA));

            proxy(sourceA, 1, true, null);
            assertEquals(Optional.of(CREATED), store.mostRecentTouch(sourceA));

            proxy(sourceA, 2, false, T0.minusSeconds(100));
            proxy(sourceA, 3, true, T0.minusSeconds(10));
            assertEquals(Optional.of(T0.minusSeconds(10)), store.mostRecentTouch(sourceA));
        }

        @Test
        void sourcesAndMissingProxy() {
            assertEquals(List.of(sourceA, sourceB), store.sourceIds());
            assertTrue(store.sourceExists(sourceA));
            assertFalse(store.sourceExists(sourceB + 1000));
            assertThrows(NotFoundException.class, () -> store.get(-1L));
        }
    }

    @Nested
    @DisplayName("markAssigned")
    class MarkAssigned {

        @Test
        @DisplayName("stamps an untouched proxy, then refuses it until the cooldown has passed")
        void cooldownIsEnforced() {
            Proxy p = proxy(sourceA, 5, false, null);

            store.markAssigned(p.getId(), T0);
            assertEquals(T0, store.get(p.getId()).getLastTouched());

            assertThrows(ConflictException.class, () -> store.markAssigned(p.getId(), T0.plusSeconds(29)));

            store.markAssigned(p.getId(), T0.plusSeconds(30));
            assertEquals(T0.plusSeconds(30), store.get(p.getId()).getLastTouched());
        }

        @Test
        void blockedIsConflict() {
            Proxy p = proxy(sourceA, 5, true, T0.minusSeconds(600));

            assertThrows(ConflictException.class, () -> store.markAssigned(p.getId(), T0));
            assertEquals(T0.minusSeconds(600), store.get(p.getId()).getLastTouched());
        }

        @Test
        void missingIsNotFound() {
            assertThrows(NotFoundException.class, () -> store.markAssigned(-1L, T0));
        }

        @Test
        @DisplayName("the conditional update only wins against the value that was read")
        void compareAndSet() {
            Proxy p = proxy(sourceA, 5, false, T0.minusSeconds(60));

            Long id = p.getId();

            assertEquals(0, cas(() -> proxyRepository.markAssignedIfTouchedAt(id, T0.minusSeconds(61), T0)));
            assertEquals(0, cas(() -> proxyRepository.markAssignedIfUntouched(id, T0)));
            assertEquals(1, cas(() -> proxyRepository.markAssignedIfTouchedAt(id, T0.minusSeconds(60), T0)));
            assertEquals(0, cas(() -> proxyRepository.markAssignedIfTouchedAt(id, T0.minusSeconds(60), T0.plusSeconds(1))));
        }
    }

    private int cas(IntSupplier update) {
        return guard.execute("cas", status -> update.getAsInt());
    }

    @Nested
    @DisplayName("blocking")
    class Blocking {

        @Test
        void setBlockedStampsLastTouched() {
            Proxy p = proxy(sourceA, 5, false, null);

            store.setBlocked(p.getId(), true, T0);

            Proxy after = store.get(p.getId());
            assertTrue(after.isBlocked());
            assertEquals(T0, after.getLastTouched());
            assertThrows(NotFoundException.class, () -> store.setBlocked(-1L, true, T0));
        }

        @Test
        @DisplayName("unblock-all touches only the source's blocked rows and keeps lastTouched")
        void unblockAllForSource() {
            Proxy a1 = proxy(sourceA, 1, true, T0.minusSeconds(900));
            Proxy a2 = proxy(sourceA, 2, true, T0.minusSeconds(800));
            proxy(sourceA, 3, false, null);
            Proxy b1 = proxy(sourceB, 4, true, T0.minusSeconds(900));

            assertEquals(2, store.unblockAllForSource(sourceA, CUTOFF));

            assertFalse(store.get(a1.getId()).isBlocked());
            assertEquals(T0.minusSeconds(800), store.get(a2.getId()).getLastTouched());
            assertTrue(store.get(b1.getId()).isBlocked());
            assertEquals(0, store.unblockAllForSource(sourceA, CUTOFF));
        }

        @Test
        @DisplayName("unblock-all does nothing once any proxy of the source was touched at or after the cutoff")
        void unblockAllRechecksCutoff() {
            Proxy a1 = proxy(sourceA, 1, true, T0.minusSeconds(900));
            Proxy a2 = proxy(sourceA, 2, true, CUTOFF);

            assertEquals(0, store.unblockAllForSource(sourceA, CUTOFF));

            assertTrue(store.get(a1.getId()).isBlocked());
            assertTrue(store.get(a2.getId()).isBlocked());
        }

        @Test
        @DisplayName("proxies created blocked and never touched are unblocked once created before the cutoff")
        void unblockAllCreatedBlocked() {
            Proxy old = proxy(sourceA, 1, true, null, T0.minusSeconds(600));
            Proxy young = proxy(sourceB, 2, true, null, T0.minusSeconds(60));

            assertEquals(1, store.unblockAllForSource(sourceA, CUTOFF));
            assertEquals(0, store.unblockAllForSource(sourceB, CUTOFF));

            assertFalse(store.get(old.getId()).isBlocked());
            assertNull(store.get(old.getId()).getLastTouched());
            assertTrue(store.get(young.getId()).isBlocked());
        }
    }
}
