package io.smsclient.client.http;

import java.util.List;
import java.util.Objects;

/**
 * One page returned by a {@link PageFetcher}.
 *
 * @param items the page's items, in order
 * @param nextOffset offset of the following page, or null to advance by {@code items.size()}
 * @param hasMore {@code false} when the source knows this is the last page, null when it does not say
 */
public record Page<T>(List<T> items, Long nextOffset, Boolean hasMore) {

    public Page {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    public static <T> Page<T> of(List<T> items) {
        return new Page<>(items, null, null);
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, null, false);
    }
}
