package com.proxycare.pool.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String message;

    // NOT_FOUND, EXHAUSTED, UNKNOWN_STATUS, ...
    private String errorCode;

    private Map<String, Object> details;

    private String traceId;
}
