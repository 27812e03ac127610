package io.smsclient.client.http;

import io.smsclient.core.PaginationOptions;
import io.smsclient.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Lazily walks a paged result set one item at a time, fetching the next page only when the buffered one is used up.
 *
 * <p>The sequence ends after an empty page, a page shorter than the page size, or a page marked
 * {@code hasMore = false}. A failed fetch leaves the position unchanged, so the next call retries the same page.
 *
 * <p>Not thread-safe; a paginator belongs to one caller.
 *
 * <pre>{@code
 * Paginator<SmsStoredMessage> messages = http.paginateMessages("+441234567890", PaginationOptions.firstPage(20));
 * Optional<SmsStoredMessage> next;
 * while ((next = messages.next()).isPresent()) {
 *     handle(next.get());
 * }
 * }</pre>
 */
public final class Paginator<T> {

    private static final Logger log = LoggerFactory.getLogger(Paginator.class);

    private final PageFetcher<T> fetcher;
    private final long pageSize;
    private final Boolean reverse;
    private final Deque<T> buffer = new ArrayDeque<>();

    private long offset;
    private boolean exhausted;

    public Paginator(PageFetcher<T> fetcher, PaginationOptions options) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(options, "options");
        this.pageSize = options.limit() != null ? options.limit() : Protocol.DEFAULT_PAGE_SIZE;
        this.offset = options.offset() != null ? options.offset() : 0L;
        this.reverse = options.reverse();
    }

    /** Pages of 50 starting at offset 0. */
    public static <T> Paginator<T> of(PageFetcher<T> fetcher) {
        return new Paginator<>(fetcher, PaginationOptions.defaults());
    }

    public static <T> Paginator<T> of(PageFetcher<T> fetcher, long pageSize) {
        return new Paginator<>(fetcher, PaginationOptions.firstPage(pageSize));
    }

    /**
     * Returns the next item, fetching a page if the buffer is empty.
     *
     * @return the next item, or empty at the end of the sequence
     * @throws FetchException if fetching the next page failed
     */
    public Optional<T> next() throws FetchException {
        if (buffer.isEmpty() && !exhausted) {
            fetchPage();
        }
        return Optional.ofNullable(buffer.poll());
    }

    /**
     * Options of the next page request: the page size, the current cursor and the ordering.
     */
    public PaginationOptions currentPagination() {
        return new PaginationOptions(pageSize, offset, reverse);
    }

    /**
     * Whether {@link #next()} may still return an item. True does not guarantee one: a full final page
     * is only known to be final after the following fetch comes back empty.
     */
    public boolean hasMore() {
        return !buffer.isEmpty() || !exhausted;
    }

    /** Drains the remaining items. */
    public List<T> collectAll() throws FetchException {
        List<T> all = new ArrayList<>();
        Optional<T> item;
        while ((item = next()).isPresent()) {
            all.add(item.get());
        }
        return all;
    }

    /** Returns up to {@code n} further items. */
    public List<T> take(int n) throws FetchException {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got: " + n);
        }
        List<T> items = new ArrayList<>(Math.min(n, (int) Math.min(pageSize, Integer.MAX_VALUE)));
        while (items.size() < n) {
            Optional<T> item = next();
            if (item.isEmpty()) {
                break;
            }
            items.add(item.get());
        }
        return items;
    }

    /** Discards up to {@code n} items. */
    public Paginator<T> skip(long n) throws FetchException {
        for (long i = 0; i < n; i++) {
            if (next().isEmpty()) {
                break;
            }
        }
        return this;
    }

    /**
     * Drains the remaining items in chunks of {@code chunkSize}; the last chunk may be shorter.
     */
    public void forEachChunk(int chunkSize, Consumer<List<T>> action) throws FetchException {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0, got: " + chunkSize);
        }
        Objects.requireNonNull(action, "action");
        List<T> chunk = new ArrayList<>(chunkSize);
        Optional<T> item;
        while ((item = next()).isPresent()) {
            chunk.add(item.get());
            if (chunk.size() >= chunkSize) {
                action.accept(List.copyOf(chunk));
                chunk.clear();
            }
        }
        if (!chunk.isEmpty()) {
            action.accept(List.copyOf(chunk));
        }
    }

    private void fetchPage() throws FetchException {
        PaginationOptions request = currentPagination();
        Page<T> page;
        try {
            page = fetcher.fetch(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(offset, e);
        } catch (Exception e) {
            throw new FetchException(offset, e);
        }
        if (page == null) {
            throw new FetchException(offset, new IllegalStateException("fetcher returned no page"));
        }

        List<T> items = page.items();
        log.trace("Fetched {} items at offset {}", items.size(), offset);
        if (items.isEmpty()) {
            exhausted = true;
            return;
        }

        buffer.addAll(items);
        offset = page.nextOffset() != null ? page.nextOffset() : offset + items.size();
        if (items.size() < pageSize || Boolean.FALSE.equals(page.hasMore())) {
            exhausted = true;
        }
    }
}
