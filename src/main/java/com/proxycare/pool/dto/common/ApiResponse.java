package com.proxycare.pool.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.proxycare.common.trace.TraceIdFilter;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Success envelope. Carries the request's trace id so a caller can quote it alongside a
 * later failure report for the same proxy.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private String message;
    private T data;
    private String traceId;

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(message, data, MDC.get(TraceIdFilter.TRACE_ID_KEY));
    }
}
