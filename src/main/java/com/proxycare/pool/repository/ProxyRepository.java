package com.proxycare.pool.repository;

import com.proxycare.pool.domain.proxy.Proxy;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ProxyRepository extends JpaRepository<Proxy, Long> {

    List<Proxy> findBySourceIdAndBlockedFalseOrderByPriorityDescIdAsc(Long sourceId);

    Page<Proxy> findBySourceIdAndBlocked(Long sourceId, boolean blocked, Pageable pageable);
    Page<Proxy> findBySourceId(Long sourceId, Pageable pageable);
    Page<Proxy> findByBlocked(boolean blocked, Pageable pageable);

    long countBySourceId(Long sourceId);

    long countBySourceIdAndBlockedTrue(Long sourceId);

    boolean existsBySourceId(Long sourceId);

    // Compare-and-set on last_touched: the caller passes what it read, zero rows means it lost

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Proxy p
           set p.lastTouched = :now
         where p.id = :id
           and p.blocked = false
           and p.lastTouched is null
    """)
    int markAssignedIfUntouched(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Proxy p
           set p.lastTouched = :now
         where p.id = :id
           and p.blocked = false
           and p.lastTouched = :expected
    """)
    int markAssignedIfTouchedAt(@Param("id") Long id,
                                @Param("expected") Instant expected,
                                @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Proxy p set p.blocked = :blocked, p.lastTouched = :now where p.id = :id")
    int updateBlocked(@Param("id") Long id, @Param("blocked") boolean blocked, @Param("now") Instant now);

    // Re-checks staleness in the same statement, so a proxy blocked after the caller's read keeps the source fresh
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Proxy p
           set p.blocked = false
         where p.sourceId = :sourceId
           and p.blocked = true
           and not exists (
                select q.id
                  from Proxy q
                 where q.sourceId = :sourceId
                   and coalesce(q.lastTouched, q.createdAt) >= :cutoff
           )
    """)
    int unblockAllIfIdleSince(@Param("sourceId") Long sourceId, @Param("cutoff") Instant cutoff);

    @Query("select max(coalesce(p.lastTouched, p.createdAt)) from Proxy p where p.sourceId = :sourceId")
    Optional<Instant> findMostRecentTouch(@Param("sourceId") Long sourceId);
}
