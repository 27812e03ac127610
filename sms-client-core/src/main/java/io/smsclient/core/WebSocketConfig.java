package io.smsclient.core;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Event channel configuration.
 * This is an immutable value type with a fluent builder API.
 */
public final class WebSocketConfig {

    /** Base delay between reconnection attempts; consecutive failures back off exponentially from it. */
    public static final Duration DEFAULT_RECONNECT_INTERVAL = Duration.ofSeconds(5);

    /** Upper bound for the reconnection backoff. */
    public static final Duration DEFAULT_MAX_RECONNECT_INTERVAL = Duration.ofSeconds(60);

    /** Idle time after which a ping is sent. */
    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(10);

    /** Time without any inbound traffic after which the channel is considered dead. */
    public static final Duration DEFAULT_PING_TIMEOUT = Duration.ofSeconds(30);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final URI url;
    private final String authorization;
    private final boolean autoReconnect;
    private final Duration reconnectInterval;
    private final Duration maxReconnectInterval;
    private final Duration pingInterval;
    private final Duration pingTimeout;
    private final Duration connectTimeout;
    private final List<String> filteredEvents;
    private final Integer maxReconnectAttempts;

    private WebSocketConfig(Builder b) {
        this.url = Urls.parse(b.url, "WebSocket URL");
        this.authorization = b.authorization;
        this.autoReconnect = b.autoReconnect;
        this.reconnectInterval = HttpConfig.requirePositive(b.reconnectInterval, "reconnectInterval");
        this.maxReconnectInterval = HttpConfig.requirePositive(b.maxReconnectInterval, "maxReconnectInterval");
        this.pingInterval = HttpConfig.requirePositive(b.pingInterval, "pingInterval");
        this.pingTimeout = HttpConfig.requirePositive(b.pingTimeout, "pingTimeout");
        this.connectTimeout = HttpConfig.requirePositive(b.connectTimeout, "connectTimeout");
        this.filteredEvents = b.filteredEvents == null ? null : List.copyOf(b.filteredEvents);
        this.maxReconnectAttempts = b.maxReconnectAttempts;

        if (maxReconnectAttempts != null && maxReconnectAttempts < 0) {
            throw new SmsClientException.InvalidConfig("maxReconnectAttempts must be >= 0, got: " + maxReconnectAttempts);
        }

        if (maxReconnectInterval.compareTo(reconnectInterval) < 0) {
            throw new SmsClientException.InvalidConfig("maxReconnectInterval must be >= reconnectInterval");
        }
    }

    public static WebSocketConfig of(String url) {
        return builder(url).build();
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    /** Event channel URL as configured, e.g. {@code ws://192.168.1.2:3000/ws}. */
    public URI url() { return url; }
    public Optional<String> authorization() { return Optional.ofNullable(authorization); }
    public boolean autoReconnect() { return autoReconnect; }
    public Duration reconnectInterval() { return reconnectInterval; }
    public Duration maxReconnectInterval() { return maxReconnectInterval; }
    public Duration pingInterval() { return pingInterval; }
    public Duration pingTimeout() { return pingTimeout; }
    public Duration connectTimeout() { return connectTimeout; }

    /** Consecutive failed attempts after which the connection gives up; empty means unlimited. */
    public Optional<Integer> maxReconnectAttempts() { return Optional.ofNullable(maxReconnectAttempts); }

    /**
     * Event types the gateway should send. Empty means no filtering: every event is sent.
     */
    public Optional<List<String>> filteredEvents() { return Optional.ofNullable(filteredEvents); }

    /**
     * The URL actually connected to: the configured URL plus the {@code events} filter, if any.
     */
    public URI connectUrl() {
        if (filteredEvents == null) {
            return url;
        }
        return Urls.withQuery(url, Map.of(Protocol.Q_EVENTS, String.join(",", filteredEvents)));
    }

    public WebSocketConfig withAuth(String token) {
        return toBuilder().authorization(token).build();
    }

    public Builder toBuilder() {
        return new Builder(url.toString())
                .authorization(authorization)
                .autoReconnect(autoReconnect)
                .reconnectInterval(reconnectInterval)
                .maxReconnectInterval(maxReconnectInterval)
                .pingInterval(pingInterval)
                .pingTimeout(pingTimeout)
                .connectTimeout(connectTimeout)
                .filteredEvents(filteredEvents)
                .maxReconnectAttempts(maxReconnectAttempts);
    }

    @Override
    public String toString() {
        return "WebSocketConfig{url=" + url + ", auth=" + (authorization != null) + ", autoReconnect=" + autoReconnect
                + ", reconnectInterval=" + reconnectInterval + ", maxReconnectInterval=" + maxReconnectInterval
                + ", pingInterval=" + pingInterval + ", pingTimeout=" + pingTimeout
                + ", filteredEvents=" + filteredEvents + "}";
    }

    public static final class Builder {
        private final String url;
        private String authorization;
        private boolean autoReconnect = true;
        private Duration reconnectInterval = DEFAULT_RECONNECT_INTERVAL;
        private Duration maxReconnectInterval = DEFAULT_MAX_RECONNECT_INTERVAL;
        private Duration pingInterval = DEFAULT_PING_INTERVAL;
        private Duration pingTimeout = DEFAULT_PING_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private List<String> filteredEvents;
        private Integer maxReconnectAttempts;

        private Builder(String url) {
            this.url = url;
        }

        public Builder authorization(String authorization) {
            this.authorization = authorization;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder reconnectInterval(Duration reconnectInterval) {
            this.reconnectInterval = reconnectInterval;
            return this;
        }

        public Builder maxReconnectInterval(Duration maxReconnectInterval) {
            this.maxReconnectInterval = maxReconnectInterval;
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public Builder pingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /** {@code null} disables filtering. */
        public Builder filteredEvents(List<String> filteredEvents) {
            this.filteredEvents = filteredEvents;
            return this;
        }

        /** {@code null} retries forever. */
        public Builder maxReconnectAttempts(Integer maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public WebSocketConfig build() {
            return new WebSocketConfig(this);
        }
    }
}
