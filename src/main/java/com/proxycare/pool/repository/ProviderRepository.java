package com.proxycare.pool.repository;

import com.proxycare.pool.domain.provider.Provider;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProviderRepository extends JpaRepository<Provider, Long> {

    boolean existsByNameIgnoreCase(String name);

    Page<Provider> findByNameContainingIgnoreCase(String q, Pageable pageable);
}
