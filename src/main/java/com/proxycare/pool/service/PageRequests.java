package com.proxycare.pool.service;

import com.proxycare.common.exception.BadRequestException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Paging and "field,dir;field2,dir" sort parsing shared by the search endpoints.
 */
final class PageRequests {

    private PageRequests() {
    }

    static Pageable of(Integer pageNumber, Integer pageSize, String sort, Set<String> sortable, Sort defaultSort) {
        int number = (pageNumber == null) ? 0 : pageNumber;
        int size = (pageSize == null) ? 25 : pageSize;

        if (number < 0) {
            throw new BadRequestException("pageNumber must be >= 0");
        }
        if (size < 1 || size > 200) {
            throw new BadRequestException("pageSize must be between 1 and 200");
        }

        return PageRequest.of(number, size, parseSortOrDefault(sort, sortable, defaultSort));
    }

    static Sort parseSortOrDefault(String sort, Set<String> sortable, Sort defaultSort) {
        String s = trimToNull(sort);
        if (s == null) {
            return defaultSort;
        }

        List<Sort.Order> orders = new ArrayList<>();
        for (String part : s.split(";")) {
            String p = part.trim();
            if (p.isEmpty()) continue;

            String[] pair = p.split(",");
            String field = pair[0].trim();
            if (field.isEmpty()) continue;
            if (!sortable.contains(field)) {
                throw BadRequestException.forField("sort", "cannot use field '" + field + "'");
            }

            String dir = (pair.length >= 2) ? pair[1].trim().toLowerCase(Locale.ROOT) : "asc";
            Sort.Direction direction = "desc".equals(dir) ? Sort.Direction.DESC : Sort.Direction.ASC;

            orders.add(new Sort.Order(direction, field));
        }

        return orders.isEmpty() ? defaultSort : Sort.by(orders);
    }

    static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
