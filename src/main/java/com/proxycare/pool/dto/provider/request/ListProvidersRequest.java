package com.proxycare.pool.dto.provider.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListProvidersRequest {

    private String q;

    private Integer pageNumber;
    private Integer pageSize;

    private String sort;
}
