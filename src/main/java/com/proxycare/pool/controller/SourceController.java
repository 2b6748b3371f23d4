package com.proxycare.pool.controller;

import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.common.PageResponse;
import com.proxycare.pool.dto.source.request.CreateSourceRequest;
import com.proxycare.pool.dto.source.request.DeleteSourceRequest;
import com.proxycare.pool.dto.source.request.ListSourcesRequest;
import com.proxycare.pool.dto.source.response.SourceResponse;
import com.proxycare.pool.service.SourceService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sources")
public class SourceController {

    private final SourceService sourceService;

    public SourceController(SourceService sourceService) {
        this.sourceService = sourceService;
    }

    @PostMapping("/search")
    public PageResponse<SourceResponse> list(@RequestBody(required = false) ListSourcesRequest request) {
        return sourceService.list(request);
    }

    @PostMapping
    public ApiResponse<SourceResponse> create(@Valid @RequestBody CreateSourceRequest request) {
        return sourceService.create(request);
    }

    @PostMapping("/delete")
    public ApiResponse<Void> delete(@Valid @RequestBody DeleteSourceRequest request) {
        return sourceService.delete(request);
    }
}
