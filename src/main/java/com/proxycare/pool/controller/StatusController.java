package com.proxycare.pool.controller;

import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.status.response.StatusOutcomeResponse;
import com.proxycare.pool.service.StatusCatalogService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/statuses")
public class StatusController {

    private final StatusCatalogService statusCatalogService;

    public StatusController(StatusCatalogService statusCatalogService) {
        this.statusCatalogService = statusCatalogService;
    }

    @GetMapping
    public ApiResponse<List<StatusOutcomeResponse>> list() {
        return statusCatalogService.list();
    }
}
