package com.proxycare.pool.service;

import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.status.response.StatusOutcomeResponse;
import com.proxycare.pool.repository.StatusOutcomeRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class StatusCatalogService {

    private final StatusOutcomeRepository statusRepository;

    public StatusCatalogService(StatusOutcomeRepository statusRepository) {
        this.statusRepository = statusRepository;
    }

    public ApiResponse<List<StatusOutcomeResponse>> list() {
        List<StatusOutcomeResponse> items = statusRepository.findAllByOrderByCodeAsc().stream()
                .map(s -> StatusOutcomeResponse.builder()
                        .statusCode(s.getCode())
                        .shortDescription(s.getShortDescription())
                        .failure(s.isFailure())
                        .build())
                .toList();
        return ApiResponse.ok("Status catalog loaded", items);
    }
}
