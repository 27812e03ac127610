package io.smsclient.core;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Request/response channel configuration.
 * This is an immutable value type with a fluent builder API.
 */
public final class HttpConfig {

    /** Timeout applied to requests without a more specific one. */
    public static final Duration DEFAULT_BASE_TIMEOUT = Duration.ofSeconds(5);

    /** Timeout applied to requests that wait on the modem; carrier round trips take longer. */
    public static final Duration DEFAULT_MODEM_TIMEOUT = Duration.ofSeconds(20);

    private final URI url;
    private final String authorization;
    private final Duration baseTimeout;
    private final Duration modemTimeout;

    private HttpConfig(Builder b) {
        this.url = Urls.parse(b.url, "HTTP URL");
        this.authorization = b.authorization;
        this.baseTimeout = requirePositive(b.baseTimeout, "baseTimeout");
        this.modemTimeout = b.modemTimeout == null ? null : requirePositive(b.modemTimeout, "modemTimeout");
    }

    public static HttpConfig of(String url) {
        return builder(url).build();
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    /** Gateway base URL, e.g. {@code http://192.168.1.2:3000}. */
    public URI url() { return url; }
    public Optional<String> authorization() { return Optional.ofNullable(authorization); }
    public Duration baseTimeout() { return baseTimeout; }

    /** Timeout for modem requests; when empty the base timeout applies to them too. */
    public Optional<Duration> modemTimeout() { return Optional.ofNullable(modemTimeout); }

    public HttpConfig withAuth(String token) {
        return toBuilder().authorization(token).build();
    }

    public Builder toBuilder() {
        return new Builder(url.toString())
                .authorization(authorization)
                .baseTimeout(baseTimeout)
                .modemTimeout(modemTimeout);
    }

    @Override
    public String toString() {
        return "HttpConfig{url=" + url + ", auth=" + (authorization != null) + ", baseTimeout=" + baseTimeout
                + ", modemTimeout=" + modemTimeout + "}";
    }

    static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new SmsClientException.InvalidConfig(name + " must be positive, got: " + d);
        }
        return d;
    }

    public static final class Builder {
        private final String url;
        private String authorization;
        private Duration baseTimeout = DEFAULT_BASE_TIMEOUT;
        private Duration modemTimeout = DEFAULT_MODEM_TIMEOUT;

        private Builder(String url) {
            this.url = url;
        }

        public Builder authorization(String authorization) {
            this.authorization = authorization;
            return this;
        }

        public Builder baseTimeout(Duration baseTimeout) {
            this.baseTimeout = baseTimeout;
            return this;
        }

        /** {@code null} applies the base timeout to modem requests. */
        public Builder modemTimeout(Duration modemTimeout) {
            this.modemTimeout = modemTimeout;
            return this;
        }

        public HttpConfig build() {
            return new HttpConfig(this);
        }
    }
}
