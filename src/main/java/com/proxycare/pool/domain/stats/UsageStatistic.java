package com.proxycare.pool.domain.stats;

import jakarta.persistence.*;
import lombok.*;

/**
 * Running count of one status code observed for one proxy.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "statistics",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_statistics_proxy_status", columnNames = {"proxy_id", "status_id"})
        }
)
public class UsageStatistic {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "proxy_id", nullable = false)
    private Long proxyId;

    @Column(name = "status_id", nullable = false)
    private Integer statusCode;

    @Column(name = "counter", nullable = false)
    private long counter;
}
