package com.proxycare.pool.repository;

import com.proxycare.pool.domain.source.Source;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface SourceRepository extends JpaRepository<Source, Long> {

    boolean existsByNameIgnoreCase(String name);

    Page<Source> findByNameContainingIgnoreCase(String q, Pageable pageable);

    @Query("select s.id from Source s order by s.id asc")
    List<Long> findAllIds();
}
