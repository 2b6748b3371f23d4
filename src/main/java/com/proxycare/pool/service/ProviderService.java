package com.proxycare.pool.service;

import com.proxycare.common.exception.BadRequestException;
import com.proxycare.pool.domain.provider.Provider;
import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.common.PageResponse;
import com.proxycare.pool.dto.provider.request.CreateProviderRequest;
import com.proxycare.pool.dto.provider.request.ListProvidersRequest;
import com.proxycare.pool.dto.provider.response.ProviderResponse;
import com.proxycare.pool.repository.ProviderRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;

@Service
public class ProviderService {

    private static final Set<String> SORTABLE = Set.of("id", "name", "createdAt");

    private final ProviderRepository providerRepository;

    public ProviderService(ProviderRepository providerRepository) {
        this.providerRepository = providerRepository;
    }

    public PageResponse<ProviderResponse> list(ListProvidersRequest request) {
        if (request == null) request = new ListProvidersRequest();

        Pageable pageable = PageRequests.of(request.getPageNumber(), request.getPageSize(), request.getSort(),
                SORTABLE, Sort.by(Sort.Order.asc("id")));

        String q = PageRequests.trimToNull(request.getQ());
        Page<Provider> page = (q == null)
                ? providerRepository.findAll(pageable)
                : providerRepository.findByNameContainingIgnoreCase(q, pageable);

        return PageResponse.of("Providers loaded", page, this::toResponse);
    }

    @Transactional
    public ApiResponse<ProviderResponse> create(CreateProviderRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }

        String name = PageRequests.trimToNull(request.getName());
        if (name == null) throw BadRequestException.forField("name", "is required");
        if (providerRepository.existsByNameIgnoreCase(name)) {
            throw BadRequestException.forField("name", "is already taken");
        }

        Provider saved = providerRepository.save(Provider.builder().name(name).build());
        return ApiResponse.ok("Provider created", toResponse(saved));
    }

    private ProviderResponse toResponse(Provider p) {
        return ProviderResponse.builder()
                .id(p.getId())
                .name(p.getName())
                .createdAt(p.getCreatedAt())
                .build();
    }
}
