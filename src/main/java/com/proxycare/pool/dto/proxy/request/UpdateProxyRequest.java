package com.proxycare.pool.dto.proxy.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProxyRequest {

    @Size(max = 100)
    private String address;

    private Long providerId;

    private Integer priority;

    @Min(1)
    private Integer usageInterval;
}
