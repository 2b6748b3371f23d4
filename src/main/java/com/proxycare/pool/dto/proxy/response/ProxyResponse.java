package com.proxycare.pool.dto.proxy.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyResponse {

    private Long id;
    private String address;

    private Long sourceId;
    private Long providerId;

    private int priority;
    private boolean blocked;

    private int usageInterval;
    private Instant lastTouched;
}
