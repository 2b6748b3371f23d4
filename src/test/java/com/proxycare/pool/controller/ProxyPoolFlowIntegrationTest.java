package com.proxycare.pool.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxycare.pool.repository.*;
import com.proxycare.pool.support.MutableClock;
import com.proxycare.pool.support.PoolTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Import(PoolTestConfig.class)
class ProxyPoolFlowIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ProxyRepository proxyRepository;

    @Autowired
    private SourceRepository sourceRepository;

    @Autowired
    private ProviderRepository providerRepository;

    @Autowired
    private UsageStatisticRepository statisticRepository;

    @Autowired
    private ProxyReportRepository reportRepository;

    private long sourceId;

    @BeforeEach
    void setUp() throws Exception {
        clock.set(PoolTestConfig.START);
        reportRepository.deleteAll();
        statisticRepository.deleteAll();
        proxyRepository.deleteAll();
        sourceRepository.deleteAll();
        providerRepository.deleteAll();

        sourceId = data(postJson("/api/sources", "{\"name\":\"shop-crawler\"}")).get("id").asLong();
    }

    private ResultActions postJson(String url, String body) throws Exception {
        return mvc.perform(post(url)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private JsonNode data(ResultActions result) throws Exception {
        String json = result.andExpect(status().isOk()).andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(json).get("data");
    }

    private long createProxy(String address, int priority) throws Exception {
        String body = String.format("{\"address\":\"%s\",\"sourceId\":%d,\"priority\":%d,\"usageInterval\":30}",
                address, sourceId, priority);
        return data(postJson("/api/proxies", body)).get("id").asLong();
    }

    private ResultActions acquire() throws Exception {
        return postJson("/api/pool/acquire", "{\"sourceId\":" + sourceId + "}");
    }

    @Test
    @DisplayName("acquire walks priorities, then answers 503 with Retry-After")
    void acquireUntilExhausted() throws Exception {
        long p1 = createProxy("10.0.0.1:8080", 100);
        long p2 = createProxy("10.0.0.2:8080", 90);

        acquire().andExpect(status().isOk())
                .andExpect(jsonPath("$.data.proxyId").value(p1))
                .andExpect(jsonPath("$.data.address").value("10.0.0.1:8080"))
                .andExpect(jsonPath("$.data.usageIntervalSeconds").value(30));
        acquire().andExpect(jsonPath("$.data.proxyId").value(p2));

        acquire().andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.errorCode").value("EXHAUSTED"))
                .andExpect(jsonPath("$.traceId").isNotEmpty());

        clock.advance(Duration.ofSeconds(30));
        acquire().andExpect(status().isOk()).andExpect(jsonPath("$.data.proxyId").value(p1));
    }

    @Test
    @DisplayName("transport failure blocks, reconciliation after the stale period brings the source back")
    void blockAndRescue() throws Exception {
        long p1 = createProxy("10.0.0.1:8080", 100);

        postJson("/api/pool/report", "{\"proxyId\":" + p1 + ",\"statusCode\":599}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.blockedByReport").value(true))
                .andExpect(jsonPath("$.data.reason").value("TRANSPORT_FAILURE"));

        acquire().andExpect(status().isServiceUnavailable());

        postJson("/api/pool/summary", "{\"sourceId\":" + sourceId + "}")
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.blocked").value(1))
                .andExpect(jsonPath("$.data.available").value(0))
                .andExpect(jsonPath("$.data.sourceName").value("shop-crawler"));

        postJson("/api/reconciliation/source", "{\"sourceId\":" + sourceId + "}")
                .andExpect(jsonPath("$.data.stale").value(false));

        clock.advance(Duration.ofMinutes(10));
        postJson("/api/reconciliation/run", "")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalUnblocked").value(1));

        acquire().andExpect(status().isOk()).andExpect(jsonPath("$.data.proxyId").value(p1));
    }

    @Test
    @DisplayName("proxies registered blocked are rescued once the source has been idle past the stale period")
    void registeredBlockedAndRescued() throws Exception {
        String body = "{\"address\":\"%s\",\"sourceId\":" + sourceId + ",\"priority\":10,\"blocked\":true}";
        long p1 = data(postJson("/api/proxies", String.format(body, "10.0.0.1:8080"))).get("id").asLong();
        data(postJson("/api/proxies", String.format(body, "10.0.0.2:8080")));

        acquire().andExpect(status().isServiceUnavailable());

        clock.advance(Duration.ofMinutes(10));
        postJson("/api/reconciliation/run", "")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalUnblocked").value(2));

        acquire().andExpect(status().isOk()).andExpect(jsonPath("$.data.proxyId").value(p1));
    }

    @Test
    @DisplayName("negative priorities are accepted and rank below zero")
    void negativePriority() throws Exception {
        long low = createProxy("10.0.0.1:8080", -5);
        long zero = createProxy("10.0.0.2:8080", 0);

        postJson("/api/proxies/search", "{\"sourceId\":" + sourceId + "}")
                .andExpect(jsonPath("$.items[1].priority").value(-5));

        mvc.perform(put("/api/proxies/{id}", zero)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"priority\":-10}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.priority").value(-10));

        acquire().andExpect(jsonPath("$.data.proxyId").value(low));
        acquire().andExpect(jsonPath("$.data.proxyId").value(zero));
    }

    @Test
    @DisplayName("health shows counters and the windowed failure ratio")
    void health() throws Exception {
        long p1 = createProxy("10.0.0.1:8080", 100);
        postJson("/api/pool/report", "{\"proxyId\":" + p1 + ",\"statusCode\":200}");
        postJson("/api/pool/report", "{\"proxyId\":" + p1 + ",\"statusCode\":404}");

        mvc.perform(get("/api/proxies/{id}/health", p1).param("window", "PT5M"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.failureRatio").value(0.5))
                .andExpect(jsonPath("$.data.window").value("PT5M"))
                .andExpect(jsonPath("$.data.statistics", hasSize(2)))
                .andExpect(jsonPath("$.data.statistics[1].description").value("Not Found"));

        mvc.perform(get("/api/proxies/{id}/health", p1).param("window", "ten minutes"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("error mapping: unknown status 422, missing source 404, bad body 400")
    void errorMapping() throws Exception {
        long p1 = createProxy("10.0.0.1:8080", 100);

        postJson("/api/pool/report", "{\"proxyId\":" + p1 + ",\"statusCode\":299}")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("UNKNOWN_STATUS"))
                .andExpect(header().doesNotExist("Retry-After"));

        postJson("/api/pool/acquire", "{\"sourceId\":987654}")
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));

        postJson("/api/pool/acquire", "{}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.errors[0].field").value("sourceId"));

        postJson("/api/proxies", "{\"address\":\"no-port\",\"sourceId\":" + sourceId + "}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("address"));
    }

    @Test
    @DisplayName("admin: operator block, search by flag, delete")
    void adminLifecycle() throws Exception {
        long p1 = createProxy("10.0.0.1:8080", 100);
        long p2 = createProxy("10.0.0.2:8080", 50);

        postJson("/api/proxies/block", "{\"proxyId\":" + p2 + ",\"blocked\":true}")
                .andExpect(jsonPath("$.data.blocked").value(true));

        postJson("/api/proxies/search", "{\"sourceId\":" + sourceId + ",\"blocked\":true}")
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].id").value(p2));

        postJson("/api/sources/delete", "{\"sourceId\":" + sourceId + "}")
                .andExpect(status().isBadRequest());

        postJson("/api/proxies/delete", "{\"proxyId\":" + p1 + "}").andExpect(status().isOk());
        postJson("/api/proxies/delete", "{\"proxyId\":" + p2 + "}").andExpect(status().isOk());
        postJson("/api/sources/delete", "{\"sourceId\":" + sourceId + "}").andExpect(status().isOk());

        mvc.perform(get("/api/statuses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[?(@.statusCode == 599)].shortDescription").value(contains("Proxy Transport Failure")));
    }

    @Test
    @DisplayName("admin: providers, proxy update and unknown provider")
    void providersAndUpdate() throws Exception {
        long providerId = data(postJson("/api/providers", "{\"name\":\"acme-proxies\"}")).get("id").asLong();
        postJson("/api/providers", "{\"name\":\"ACME-PROXIES\"}").andExpect(status().isBadRequest());

        postJson("/api/providers/search", "{\"q\":\"acme\"}")
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.meta.totalElements").value(1));

        long p1 = createProxy("10.0.0.1:8080", 100);

        mvc.perform(put("/api/proxies/{id}", p1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"providerId\":" + providerId + ",\"priority\":7,\"usageInterval\":90}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.providerId").value(providerId))
                .andExpect(jsonPath("$.data.priority").value(7))
                .andExpect(jsonPath("$.data.usageInterval").value(90));

        mvc.perform(put("/api/proxies/{id}", p1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"providerId\":424242}"))
                .andExpect(status().isNotFound());

        acquire().andExpect(jsonPath("$.data.usageIntervalSeconds").value(90));
    }
}
