package com.proxycare.pool.controller;

import com.proxycare.common.exception.ConflictException;
import com.proxycare.common.exception.PoolFailureException;
import com.proxycare.common.exception.PoolFailureReason;
import com.proxycare.common.trace.TraceIdFilter;
import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.pool.request.AcquireProxyRequest;
import com.proxycare.pool.dto.pool.request.PoolSummaryRequest;
import com.proxycare.pool.dto.pool.response.ProxyHandleResponse;
import com.proxycare.pool.service.ProxyPoolService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProxyPoolController.class)
class ProxyPoolControllerTest {

    private static final String ACQUIRE = "{\"sourceId\":1}";

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ProxyPoolService proxyPoolService;

    @Test
    @DisplayName("handle is wrapped in ApiResponse and the caller's trace id is echoed")
    void acquireOk() throws Exception {
        ProxyHandleResponse handle = ProxyHandleResponse.builder()
                .proxyId(7L)
                .address("10.0.0.7:3128")
                .sourceId(1L)
                .usageIntervalSeconds(30)
                .assignedAt(Instant.parse("2026-03-01T12:00:00Z"))
                .reusableAt(Instant.parse("2026-03-01T12:00:30Z"))
                .build();
        when(proxyPoolService.acquire(any(AcquireProxyRequest.class)))
                .thenAnswer(invocation -> ApiResponse.ok("Proxy assigned", handle));

        mvc.perform(post("/api/pool/acquire")
                        .header(TraceIdFilter.TRACE_ID_HEADER, "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ACQUIRE))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_ID_HEADER, "trace-123"))
                .andExpect(jsonPath("$.message").value("Proxy assigned"))
                .andExpect(jsonPath("$.traceId").value("trace-123"))
                .andExpect(jsonPath("$.data.proxyId").value(7))
                .andExpect(jsonPath("$.data.reusableAt").value("2026-03-01T12:00:30Z"));
    }

    @Test
    @DisplayName("store outage is 503 UNAVAILABLE and retryable")
    void unavailable() throws Exception {
        when(proxyPoolService.acquire(any(AcquireProxyRequest.class)))
                .thenThrow(new PoolFailureException("Proxy store unavailable", PoolFailureReason.UNAVAILABLE));

        mvc.perform(post("/api/pool/acquire").contentType(MediaType.APPLICATION_JSON).content(ACQUIRE))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.errorCode").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.details.retryable").value(true));
    }

    @Test
    @DisplayName("a database outage outside the store guard is still 503 UNAVAILABLE")
    void summaryDuringOutage() throws Exception {
        when(proxyPoolService.summary(any(PoolSummaryRequest.class)))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        mvc.perform(post("/api/pool/summary").contentType(MediaType.APPLICATION_JSON).content(ACQUIRE))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.errorCode").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.details.retryable").value(true));
    }

    @Test
    void dataSourceFailureIsUnavailable() throws Exception {
        when(proxyPoolService.summary(any(PoolSummaryRequest.class)))
                .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        mvc.perform(post("/api/pool/summary").contentType(MediaType.APPLICATION_JSON).content(ACQUIRE))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("UNAVAILABLE"));
    }

    @Test
    @DisplayName("a conflict that escapes is 409")
    void conflict() throws Exception {
        when(proxyPoolService.acquire(any(AcquireProxyRequest.class)))
                .thenThrow(new ConflictException("Proxy was assigned concurrently"));

        mvc.perform(post("/api/pool/acquire").contentType(MediaType.APPLICATION_JSON).content(ACQUIRE))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CONFLICT"));
    }

    @Test
    @DisplayName("anything else is 500 with a trace id")
    void unexpected() throws Exception {
        when(proxyPoolService.acquire(any(AcquireProxyRequest.class)))
                .thenThrow(new IllegalStateException("boom"));

        mvc.perform(post("/api/pool/acquire").contentType(MediaType.APPLICATION_JSON).content(ACQUIRE))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_SERVER_ERROR"))
                .andExpect(jsonPath("$.traceId").isNotEmpty());
    }

    @Test
    void malformedBody() throws Exception {
        mvc.perform(post("/api/pool/acquire").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void reportStatusOutOfRange() throws Exception {
        mvc.perform(post("/api/pool/report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"proxyId\":1,\"statusCode\":42}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.errors[0].field").value("statusCode"));
    }
}
