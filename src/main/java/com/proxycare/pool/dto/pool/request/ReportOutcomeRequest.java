package com.proxycare.pool.dto.pool.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportOutcomeRequest {

    @NotNull
    private Long proxyId;

    // catalog membership is checked by the service, this only rejects obvious garbage
    @NotNull
    @Min(100)
    @Max(599)
    private Integer statusCode;
}
