package com.proxycare.pool.domain.proxy;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "proxies",
        indexes = {
                @Index(name = "idx_proxies_source_blocked_priority", columnList = "source_id,blocked,priority"),
                @Index(name = "idx_proxies_source_last_touched", columnList = "source_id,last_touched")
        }
)
public class Proxy {

    public static final int DEFAULT_USAGE_INTERVAL_SECONDS = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // host:port, duplicates across sources allowed
    @Column(name = "address", nullable = false, length = 100)
    private String address;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "provider_id")
    private Long providerId;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "blocked", nullable = false)
    private boolean blocked;

    /** Minimum gap between two assignments of this proxy, in seconds. */
    @Column(name = "usage_interval", nullable = false)
    private Integer usageInterval;

    /** Null until the proxy is first assigned or blocked. */
    @Column(name = "last_touched")
    private Instant lastTouched;

    /** Stands in for lastTouched when judging staleness of a proxy that was never touched. */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (usageInterval == null) usageInterval = DEFAULT_USAGE_INTERVAL_SECONDS;
        if (createdAt == null) createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public Duration getUsageCooldown() {
        int seconds = (usageInterval == null) ? DEFAULT_USAGE_INTERVAL_SECONDS : usageInterval;
        return Duration.ofSeconds(seconds);
    }

    /**
     * True while {@code now} is still inside the cooldown that started at {@link #lastTouched}.
     */
    public boolean isCoolingDown(Instant now) {
        return lastTouched != null && now.isBefore(lastTouched.plus(getUsageCooldown()));
    }

    /** lastTouched, or createdAt when the proxy was never assigned nor blocked. */
    public Instant getLastActivity() {
        return (lastTouched != null) ? lastTouched : createdAt;
    }
}
