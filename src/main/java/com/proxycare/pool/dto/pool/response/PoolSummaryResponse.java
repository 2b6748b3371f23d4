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
public class PoolSummaryResponse {

    private Long sourceId;
    private String sourceName;

    private long total;
    private long blocked;
    private long unblocked;

    // unblocked and out of cooldown right now
    private long available;

    private Instant mostRecentTouch;
    private boolean reconciling;
}
