package com.proxycare.pool.config;

import com.proxycare.pool.application.health.BlockingPolicy;
import com.proxycare.pool.application.health.ThresholdBlockingPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ProxyPoolProperties.class)
public class ProxyPoolConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BlockingPolicy blockingPolicy(ProxyPoolProperties properties) {
        return new ThresholdBlockingPolicy(properties.getBlocking());
    }

    /**
     * One thread per source being reconciled, at most {@code max-concurrent-sources} at once.
     */
    @Bean
    public ThreadPoolTaskExecutor reconciliationExecutor(ProxyPoolProperties properties) {
        int size = properties.getReconciliation().getMaxConcurrentSources();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix("Reconcile-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
