package com.proxycare.pool.dto.pool.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportOutcomeResponse {

    private Long proxyId;
    private int statusCode;
    private long counter;

    private boolean blocked;
    private boolean blockedByReport;
    private String reason;

    private double failureRatio;
}
