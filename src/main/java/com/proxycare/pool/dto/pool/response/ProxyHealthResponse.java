package com.proxycare.pool.dto.pool.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyHealthResponse {

    private Long proxyId;
    private boolean blocked;

    private String window;
    private double failureRatio;

    private List<StatusCountResponse> statistics;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusCountResponse {
        private int statusCode;
        private String description;
        private long counter;
    }
}
