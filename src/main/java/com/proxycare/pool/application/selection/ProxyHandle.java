package com.proxycare.pool.application.selection;

import com.proxycare.pool.domain.proxy.Proxy;

import java.time.Duration;
import java.time.Instant;

/**
 * A proxy handed to one caller. Nobody else gets it before {@code assignedAt + usageCooldown}.
 */
public record ProxyHandle(
        Long proxyId,
        String address,
        Long sourceId,
        Long providerId,
        int priority,
        Duration usageCooldown,
        Instant assignedAt
) {

    public static ProxyHandle of(Proxy proxy, Instant assignedAt) {
        return new ProxyHandle(
                proxy.getId(),
                proxy.getAddress(),
                proxy.getSourceId(),
                proxy.getProviderId(),
                proxy.getPriority(),
                proxy.getUsageCooldown(),
                assignedAt
        );
    }

    public Instant reusableAt() {
        return assignedAt.plus(usageCooldown);
    }
}
