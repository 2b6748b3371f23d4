package com.proxycare.pool.dto.proxy.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetProxyBlockedRequest {

    @NotNull
    private Long proxyId;

    @NotNull
    private Boolean blocked;
}
