package com.proxycare.pool.dto.proxy.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListProxiesRequest {

    private Long sourceId;

    private Boolean blocked;

    private Integer pageNumber;
    private Integer pageSize;

    private String sort;
}
