package com.proxycare.pool.dto.source.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListSourcesRequest {

    // substring of the name
    private String q;

    private Integer pageNumber;
    private Integer pageSize;

    private String sort;
}
