package com.proxycare.pool.dto.reconcile.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileOutcomeResponse {

    private Long sourceId;
    private Instant mostRecentTouch;
    private boolean stale;
    private int unblocked;
}
