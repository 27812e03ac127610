package io.smsclient.core;

/**
 * Pagination options for lazy reads of large result sets (message history, latest numbers, delivery reports).
 *
 * <p>Applied by the gateway when it queries its database. All fields are optional and omitted from
 * the request body when {@code null}.
 *
 * @param limit the maximum number of items to return (the page size)
 * @param offset the index to start returning items from; with a limit of 5 the second page is at offset 5
 * @param reverse whether to return items in reverse order, which reads the newest items first
 */
public record PaginationOptions(Long limit, Long offset, Boolean reverse) {

    public PaginationOptions {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
    }

    public static PaginationOptions defaults() {
        return new PaginationOptions(null, null, null);
    }

    /** First page of the given size, starting at offset 0. */
    public static PaginationOptions firstPage(long pageSize) {
        return new PaginationOptions(pageSize, 0L, null);
    }

    public PaginationOptions withLimit(long limit) {
        return new PaginationOptions(limit, offset, reverse);
    }

    public PaginationOptions withOffset(long offset) {
        return new PaginationOptions(limit, offset, reverse);
    }

    public PaginationOptions withReverse(boolean reverse) {
        return new PaginationOptions(limit, offset, reverse);
    }
}
