package com.proxycare.pool.dto.pool.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyHandleResponse {

    private Long proxyId;
    private String address;

    private Long sourceId;
    private Long providerId;
    private int priority;

    private long usageIntervalSeconds;
    private Instant assignedAt;
    private Instant reusableAt;
}
