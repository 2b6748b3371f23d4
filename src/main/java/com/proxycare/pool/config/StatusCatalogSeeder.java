package com.proxycare.pool.config;

import com.proxycare.pool.domain.status.StatusCatalog;
import com.proxycare.pool.domain.status.StatusOutcome;
import com.proxycare.pool.repository.StatusOutcomeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Inserts catalog codes that are missing. Existing rows are never changed.
 */
@Component
@ConditionalOnProperty(name = "proxypool.catalog.seed-on-startup", havingValue = "true", matchIfMissing = true)
public class StatusCatalogSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StatusCatalogSeeder.class);

    private final StatusOutcomeRepository statusRepository;

    public StatusCatalogSeeder(StatusOutcomeRepository statusRepository) {
        this.statusRepository = statusRepository;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        Set<Integer> present = new HashSet<>();
        statusRepository.findAll().forEach(s -> present.add(s.getCode()));

        List<StatusOutcome> missing = StatusCatalog.defaults().entrySet().stream()
                .filter(e -> !present.contains(e.getKey()))
                .map(e -> StatusOutcome.builder().code(e.getKey()).shortDescription(e.getValue()).build())
                .toList();

        if (!missing.isEmpty()) {
            statusRepository.saveAll(missing);
            log.info("Status catalog seeded with {} codes", missing.size());
        }
    }
}
