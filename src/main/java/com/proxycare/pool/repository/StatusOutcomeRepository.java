package com.proxycare.pool.repository;

import com.proxycare.pool.domain.status.StatusOutcome;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StatusOutcomeRepository extends JpaRepository<StatusOutcome, Integer> {

    List<StatusOutcome> findAllByOrderByCodeAsc();
}
