package io.smsclient.transport.spi;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single call against the gateway's REST surface, as handed to an {@link HttpClientAdapter}.
 *
 * <p>{@link #toString()} never prints the authorization token, so requests can be logged as-is.
 *
 * @param uri absolute target
 * @param method {@code GET} or {@code POST}
 * @param headers header map, insertion ordered
 * @param body request body, or {@code null} for none
 * @param timeout per-request timeout, or {@code null} for the adapter's default
 */
public record HttpClientRequest(URI uri, String method, Map<String, String> headers, byte[] body, Duration timeout) {

    public static final String AUTHORIZATION = "Authorization";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String JSON = "application/json";

    public HttpClientRequest {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(method, "method");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static Builder get(URI uri) {
        return new Builder(uri, "GET");
    }

    public static Builder post(URI uri) {
        return new Builder(uri, "POST");
    }

    /** Case-insensitive header lookup. */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(method).append(' ').append(uri);
        headers.forEach((name, value) -> sb.append(' ').append(name).append('=')
                .append(name.equalsIgnoreCase(AUTHORIZATION) ? "***" : value));
        if (body != null) {
            sb.append(" body=").append(new String(body, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        /** Sets the token the gateway expects verbatim in {@code Authorization}. */
        public Builder authorization(String token) {
            return header(AUTHORIZATION, token);
        }

        public Builder jsonBody(byte[] json) {
            header(CONTENT_TYPE, JSON);
            this.body = Objects.requireNonNull(json, "json");
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(uri, method, headers, body, timeout);
        }
    }
}
