package com.proxycare.pool.domain.stats;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One reported outcome, kept so failure ratios can be computed over a time window.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "proxy_reports",
        indexes = {
                @Index(name = "idx_proxy_reports_proxy_reported_at", columnList = "proxy_id,reported_at")
        }
)
public class ProxyReport {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "proxy_id", nullable = false)
    private Long proxyId;

    @Column(name = "status_code", nullable = false)
    private Integer statusCode;

    @Column(name = "reported_at", nullable = false)
    private Instant reportedAt;
}
