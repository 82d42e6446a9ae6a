package com.entity.canonical.api;

import java.util.List;

/**
 * One slice of a paged read, such as the pending candidate links awaiting review.
 *
 * @param content       rows of this slice, in store order
 * @param totalElements rows matching the query across all slices
 * @param pageNumber    index of this slice, from 0
 * @param pageSize      slice size that was requested
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
    }

    /**
     * Wraps the rows read for {@code request}.
     */
    public static <T> Page<T> of(List<T> rows, long totalElements, PageRequest request) {
        return new Page<>(rows, totalElements, request.pageNumber(), request.limit());
    }

    public static <T> Page<T> empty(PageRequest request) {
        return of(List.of(), 0, request);
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return (int) ((totalElements + pageSize - 1) / pageSize);
    }

    public int numberOfElements() {
        return content.size();
    }
}
