package com.proxycare.pool.dto.source.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// Deletion is refused while the source still owns proxies
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeleteSourceRequest {

    @NotNull
    private Long sourceId;
}
