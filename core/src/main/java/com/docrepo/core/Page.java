package com.docrepo.core;

import java.util.List;

/**
 * Pagination envelope returned to callers.
 *
 * @param totalCount records matching the query
 * @param totalPages derived from totalCount and size, see {@link #totalPages(long, int)}
 * @param page       1-based page number
 * @param size       requested page length
 * @param data       records of this page
 */
public record Page<T>(long totalCount, long totalPages, int page, int size, List<T> data) {

    public static <T> Page<T> of(Listing<T> listing, int page, int size) {
        return new Page<>(listing.totalCount(), totalPages(listing.totalCount(), size), page, size, listing.items());
    }

    /**
     * 0 for an empty result, otherwise the ceiling of totalCount / size.
     */
    public static long totalPages(long totalCount, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive, got " + size);
        }
        if (totalCount == 0) {
            return 0;
        }
        return (totalCount + size - 1) / size;
    }
}
