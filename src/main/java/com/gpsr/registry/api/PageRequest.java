package com.gpsr.registry.api;

/**
 * Offset/limit pagination request for registry listings.
 */
public record PageRequest(int offset, int limit) {

    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }

    /**
     * Creates a page request from a 0-based page number and a page size.
     */
    public static PageRequest of(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        return new PageRequest(page * size, size);
    }

    public static PageRequest first(int size) {
        return new PageRequest(0, size);
    }

    /**
     * Returns a copy whose limit does not exceed {@code maxLimit}.
     */
    public PageRequest capped(int maxLimit) {
        return limit <= maxLimit ? this : new PageRequest(offset, maxLimit);
    }

    public int pageNumber() {
        return offset / limit;
    }
}
