package com.proxycare.pool.dto.status.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusOutcomeResponse {

    private int statusCode;
    private String shortDescription;
    private boolean failure;
}
