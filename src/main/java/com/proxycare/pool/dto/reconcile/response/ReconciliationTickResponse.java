package com.proxycare.pool.dto.reconcile.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationTickResponse {

    private String traceId;
    private Instant startedAt;

    private int totalUnblocked;
    private List<ReconcileOutcomeResponse> outcomes;

    private List<Long> skipped;
    private List<Long> failed;
}
