package io.smsclient.client.http;

import io.smsclient.core.PaginationOptions;

/**
 * Fetches one page for a {@link Paginator}.
 */
@FunctionalInterface
public interface PageFetcher<T> {

    /**
     * @param options limit, offset and ordering of the requested page; never null
     * @throws Exception any failure; the paginator wraps it in a {@link FetchException}
     */
    Page<T> fetch(PaginationOptions options) throws Exception;
}
