package com.proxycare.pool.dto.source.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceResponse {

    private Long id;
    private String name;
    private Instant createdAt;
}
