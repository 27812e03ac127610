package io.smsclient.transport.spi;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * A fully read gateway response. The gateway wraps every JSON answer in a
 * {@code {"success": ..., "response": ...}} envelope; proxies in front of it may not.
 */
public interface HttpClientResponse {

    int statusCode();

    /**
     * @param name header name, matched case-insensitively
     * @return the first value, or empty if absent
     */
    Optional<String> header(String name);

    /** The raw body, empty rather than null when there was none. */
    byte[] body();

    default boolean isSuccess() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /** Whether the server labelled the body {@code application/json}, with or without parameters. */
    default boolean isJson() {
        return header(HttpClientRequest.CONTENT_TYPE)
                .map(ct -> ct.toLowerCase(Locale.ROOT).startsWith(HttpClientRequest.JSON))
                .orElse(false);
    }

    default String bodyText() {
        return new String(body(), StandardCharsets.UTF_8);
    }
}
