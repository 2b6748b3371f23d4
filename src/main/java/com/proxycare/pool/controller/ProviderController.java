package com.proxycare.pool.controller;

import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.common.PageResponse;
import com.proxycare.pool.dto.provider.request.CreateProviderRequest;
import com.proxycare.pool.dto.provider.request.ListProvidersRequest;
import com.proxycare.pool.dto.provider.response.ProviderResponse;
import com.proxycare.pool.service.ProviderService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/providers")
public class ProviderController {

    private final ProviderService providerService;

    public ProviderController(ProviderService providerService) {
        this.providerService = providerService;
    }

    @PostMapping("/search")
    public PageResponse<ProviderResponse> list(@RequestBody(required = false) ListProvidersRequest request) {
        return providerService.list(request);
    }

    @PostMapping
    public ApiResponse<ProviderResponse> create(@Valid @RequestBody CreateProviderRequest request) {
        return providerService.create(request);
    }
}
