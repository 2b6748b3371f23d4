package com.proxycare.pool.dto.proxy.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateProxyRequest {

    // host:port
    @NotBlank
    @Size(max = 100)
    private String address;

    @NotNull
    private Long sourceId;

    private Long providerId;

    // any integer; higher is preferred
    private int priority;

    // seconds; the configured default applies when absent
    @Min(1)
    private Integer usageInterval;

    private Boolean blocked;
}
