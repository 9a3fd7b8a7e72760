package com.gpsr.registry.api;

import java.util.List;
import java.util.function.Function;

/**
 * A page of results from a listing.
 *
 * @param content       the rows of this page
 * @param totalElements number of rows matching the listing across all pages
 * @param offset        offset of the first row of this page
 * @param limit         requested page size
 * @param <T>           the row type
 */
public record Page<T>(List<T> content, long totalElements, int offset, int limit) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Cuts the requested window out of an already filtered and ordered list.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        int total = all.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(request.offset() + request.limit(), total);
        return new Page<>(all.subList(from, to), total, request.offset(), request.limit());
    }

    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = content.stream().<R>map(mapper).toList();
        return new Page<>(mapped, totalElements, offset, limit);
    }

    public boolean hasNext() {
        return (long) offset + content.size() < totalElements;
    }

    public int numberOfElements() {
        return content.size();
    }
}
