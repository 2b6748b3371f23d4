package com.proxycare.pool.repository;

import com.proxycare.pool.domain.stats.ProxyReport;
import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ProxyReportRepository extends JpaRepository<ProxyReport, Long> {

    @Query("""
        select r.statusCode
        from ProxyReport r
        where r.proxyId = :proxyId
          and r.reportedAt >= :since
        order by r.reportedAt asc, r.id asc
    """)
    List<Integer> findStatusCodesSince(@Param("proxyId") Long proxyId, @Param("since") Instant since);

    long countByProxyIdAndReportedAtGreaterThanEqual(Long proxyId, Instant since);

    long countByProxyIdAndReportedAtGreaterThanEqualAndStatusCodeGreaterThanEqual(Long proxyId, Instant since, Integer statusCode);

    @Modifying
    @Query("delete from ProxyReport r where r.proxyId = :proxyId")
    int deleteByProxyId(@Param("proxyId") Long proxyId);
}
