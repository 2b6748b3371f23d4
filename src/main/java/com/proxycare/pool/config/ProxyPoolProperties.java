package com.proxycare.pool.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Validated
@ConfigurationProperties(prefix = "proxypool")
public class ProxyPoolProperties {

    @Valid
    private Selection selection = new Selection();

    @Valid
    private Blocking blocking = new Blocking();

    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    @Valid
    private Catalog catalog = new Catalog();

    @Data
    public static class Selection {
        /** Cooldown given to proxies registered without one. */
        @NotNull
        private Duration defaultUsageInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Blocking {
        /** Status a caller reports when it could not reach the proxy at all. */
        private int transportFailureStatus = 599;

        private Set<Integer> blockingStatuses = new LinkedHashSet<>(List.of(403, 407, 429, 500, 502, 503, 504));

        @Min(1)
        private int failureThreshold = 3;

        @NotNull
        private Duration window = Duration.ofMinutes(10);

        @Min(1)
        private int minSamples = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxFailureRatio = 0.8;
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;

        @NotNull
        private Duration interval = Duration.ofMinutes(3);

        @NotNull
        private Duration initialDelay = Duration.ofSeconds(30);

        @NotNull
        private Duration staleAfter = Duration.ofMinutes(5);

        @Min(1)
        private int maxConcurrentSources = 4;
    }

    @Data
    public static class Catalog {
        private boolean seedOnStartup = true;
    }
}
