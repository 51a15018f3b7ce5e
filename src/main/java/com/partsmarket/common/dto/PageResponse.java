package com.partsmarket.common.dto;

import org.springframework.data.domain.Page;

import java.util.List;

/**
 * One page of results. {@code page} is 1-based.
 */
public record PageResponse<T>(
        List<T> items,
        int page,
        int pageSize,
        long total,
        boolean hasMore
) {
    public static <T> PageResponse<T> from(Page<T> page) {
        return new PageResponse<>(
                page.getContent(),
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                page.hasNext());
    }
}
