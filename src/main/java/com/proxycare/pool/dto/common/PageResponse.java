package com.proxycare.pool.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageResponse<T> {

    private String message;

    private List<T> items;

    private PageMeta meta;

    public static <E, T> PageResponse<T> of(String message, Page<E> page, Function<E, T> mapper) {
        PageMeta meta = PageMeta.builder()
                .pageNumber(page.getNumber())
                .pageSize(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .hasNext(page.hasNext())
                .hasPrevious(page.hasPrevious())
                .sort(sortToString(page.getSort()))
                .build();

        return PageResponse.<T>builder()
                .message(message)
                .items(page.getContent().stream().map(mapper).toList())
                .meta(meta)
                .build();
    }

    private static String sortToString(Sort sort) {
        if (sort == null || sort.isUnsorted()) return null;

        StringBuilder sb = new StringBuilder();
        for (Sort.Order o : sort) {
            if (sb.length() > 0) sb.append(";");
            sb.append(o.getProperty())
                    .append(",")
                    .append(o.getDirection().name().toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PageMeta {
        private int pageNumber;
        private int pageSize;

        private long totalElements;
        private int totalPages;

        private boolean hasNext;
        private boolean hasPrevious;

        private String sort;
    }
}
