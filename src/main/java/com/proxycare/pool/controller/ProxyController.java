package com.proxycare.pool.controller;

import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.common.PageResponse;
import com.proxycare.pool.dto.pool.response.ProxyHealthResponse;
import com.proxycare.pool.dto.proxy.request.*;
import com.proxycare.pool.dto.proxy.response.ProxyResponse;
import com.proxycare.pool.service.ProxyPoolService;
import com.proxycare.pool.service.ProxyService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/proxies")
public class ProxyController {

    private final ProxyService proxyService;
    private final ProxyPoolService proxyPoolService;

    public ProxyController(ProxyService proxyService, ProxyPoolService proxyPoolService) {
        this.proxyService = proxyService;
        this.proxyPoolService = proxyPoolService;
    }

    @PostMapping("/search")
    public PageResponse<ProxyResponse> search(@RequestBody(required = false) ListProxiesRequest request) {
        return proxyService.search(request);
    }

    @PostMapping
    public ApiResponse<ProxyResponse> create(@Valid @RequestBody CreateProxyRequest request) {
        return proxyService.create(request);
    }

    @PutMapping("/{proxyId}")
    public ApiResponse<ProxyResponse> update(@PathVariable Long proxyId, @Valid @RequestBody UpdateProxyRequest request) {
        return proxyService.update(proxyId, request);
    }

    @PostMapping("/block")
    public ApiResponse<ProxyResponse> setBlocked(@Valid @RequestBody SetProxyBlockedRequest request) {
        return proxyService.setBlocked(request);
    }

    @PostMapping("/delete")
    public ApiResponse<Void> delete(@Valid @RequestBody DeleteProxyRequest request) {
        return proxyService.delete(request);
    }

    @GetMapping("/{proxyId}/health")
    public ApiResponse<ProxyHealthResponse> health(@PathVariable Long proxyId,
                                                   @RequestParam(required = false) String window) {
        return proxyPoolService.health(proxyId, window);
    }
}
