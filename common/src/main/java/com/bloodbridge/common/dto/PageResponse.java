package com.bloodbridge.common.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Page of results plus the pagination block clients use to render "next"/"previous".
 */
public record PageResponse<T>(
        List<T> data,
        Pagination pagination
) {
    public record Pagination(
            int page,
            int limit,
            long total,
            int pages,
            boolean hasNext,
            boolean hasPrev
    ) {
    }

    /**
     * Converts a zero-based Spring Data page into the one-based page block used on the wire.
     */
    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        List<T> items = page.getContent().stream().map(mapper).toList();
        int current = page.getNumber() + 1;
        return new PageResponse<>(items, new Pagination(
                current,
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages(),
                page.hasNext(),
                page.hasPrevious()
        ));
    }
}
