package com.proxycare.pool.service;

import com.proxycare.common.exception.BadRequestException;
import com.proxycare.common.exception.NotFoundException;
import com.proxycare.pool.domain.source.Source;
import com.proxycare.pool.dto.common.ApiResponse;
import com.proxycare.pool.dto.common.PageResponse;
import com.proxycare.pool.dto.source.request.CreateSourceRequest;
import com.proxycare.pool.dto.source.request.DeleteSourceRequest;
import com.proxycare.pool.dto.source.request.ListSourcesRequest;
import com.proxycare.pool.dto.source.response.SourceResponse;
import com.proxycare.pool.repository.ProxyRepository;
import com.proxycare.pool.repository.SourceRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;

@Service
public class SourceService {

    private static final Set<String> SORTABLE = Set.of("id", "name", "createdAt");

    private final SourceRepository sourceRepository;
    private final ProxyRepository proxyRepository;

    public SourceService(SourceRepository sourceRepository, ProxyRepository proxyRepository) {
        this.sourceRepository = sourceRepository;
        this.proxyRepository = proxyRepository;
    }

    public PageResponse<SourceResponse> list(ListSourcesRequest request) {
        if (request == null) request = new ListSourcesRequest();

        Pageable pageable = PageRequests.of(request.getPageNumber(), request.getPageSize(), request.getSort(),
                SORTABLE, Sort.by(Sort.Order.asc("id")));

        String q = PageRequests.trimToNull(request.getQ());
        Page<Source> page = (q == null)
                ? sourceRepository.findAll(pageable)
                : sourceRepository.findByNameContainingIgnoreCase(q, pageable);

        return PageResponse.of("Sources loaded", page, this::toResponse);
    }

    @Transactional
    public ApiResponse<SourceResponse> create(CreateSourceRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }

        String name = PageRequests.trimToNull(request.getName());
        if (name == null) throw BadRequestException.forField("name", "is required");
        if (sourceRepository.existsByNameIgnoreCase(name)) {
            throw BadRequestException.forField("name", "is already taken");
        }

        Source saved = sourceRepository.save(Source.builder().name(name).build());
        return ApiResponse.ok("Source created", toResponse(saved));
    }

    /**
     * Only empty sources can be deleted; proxies are removed one by one through the proxy admin API.
     */
    @Transactional
    public ApiResponse<Void> delete(DeleteSourceRequest request) {
        if (request == null || request.getSourceId() == null) {
            throw BadRequestException.forField("sourceId", "is required");
        }

        Long id = request.getSourceId();
        if (!sourceRepository.existsById(id)) {
            throw NotFoundException.of("Source", id);
        }
        if (proxyRepository.existsBySourceId(id)) {
            throw new BadRequestException("Source still has proxies");
        }

        sourceRepository.deleteById(id);
        return ApiResponse.ok("Source deleted", null);
    }

    private SourceResponse toResponse(Source s) {
        return SourceResponse.builder()
                .id(s.getId())
                .name(s.getName())
                .createdAt(s.getCreatedAt())
                .build();
    }
}
