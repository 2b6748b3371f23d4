package com.proxycare.pool.repository;

import com.proxycare.pool.domain.stats.UsageStatistic;
import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface UsageStatisticRepository extends JpaRepository<UsageStatistic, Long> {

    Optional<UsageStatistic> findByProxyIdAndStatusCode(Long proxyId, Integer statusCode);

    List<UsageStatistic> findByProxyIdOrderByStatusCodeAsc(Long proxyId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update UsageStatistic s set s.counter = s.counter + 1 where s.proxyId = :proxyId and s.statusCode = :statusCode")
    int incrementCounter(@Param("proxyId") Long proxyId, @Param("statusCode") Integer statusCode);

    @Modifying
    @Query("delete from UsageStatistic s where s.proxyId = :proxyId")
    int deleteByProxyId(@Param("proxyId") Long proxyId);
}
