package com.bloodbridge.common.util;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

/**
 * Builds page requests from the one-based {@code page}/{@code limit} query parameters.
 */
public final class Paging {
    private Paging() {
        // Utility class
    }

    public static PageRequest of(Integer page, Integer limit, Sort sort) {
        int p = (page == null || page < 1) ? 1 : page;
        int size = (limit == null || limit < 1) ? Constants.DEFAULT_PAGE_SIZE : Math.min(limit, Constants.MAX_PAGE_SIZE);
        return PageRequest.of(p - 1, size, sort);
    }
}
