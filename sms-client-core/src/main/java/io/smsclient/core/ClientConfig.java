package io.smsclient.core;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Top-level client configuration: an optional request channel, an optional event channel
 * and optional TLS settings shared by both. At least one channel must be configured.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.both("http://gateway:3000", "ws://gateway:3000/ws")
 *         .withAuth("token")
 *         .withCertificate(Path.of("gateway.crt"));
 * }</pre>
 */
public final class ClientConfig {

    /** Property key prefix read by {@link #fromProperties(Properties)}. */
    public static final String PREFIX = "sms.";

    private final TlsConfig tls;
    private final HttpConfig http;
    private final WebSocketConfig websocket;

    private ClientConfig(TlsConfig tls, HttpConfig http, WebSocketConfig websocket) {
        if (http == null && websocket == null) {
            throw new SmsClientException.InvalidConfig("At least one of the HTTP or WebSocket channels must be configured");
        }
        this.tls = tls;
        this.http = http;
        this.websocket = websocket;
    }

    public static ClientConfig httpOnly(String httpUrl) {
        return new ClientConfig(null, HttpConfig.of(httpUrl), null);
    }

    public static ClientConfig websocketOnly(String websocketUrl) {
        return new ClientConfig(null, null, WebSocketConfig.of(websocketUrl));
    }

    public static ClientConfig both(String httpUrl, String websocketUrl) {
        return new ClientConfig(null, HttpConfig.of(httpUrl), WebSocketConfig.of(websocketUrl));
    }

    /**
     * @param http request channel, or {@code null}
     * @param websocket event channel, or {@code null}
     */
    public static ClientConfig of(HttpConfig http, WebSocketConfig websocket) {
        return new ClientConfig(null, http, websocket);
    }

    public Optional<TlsConfig> tls() { return Optional.ofNullable(tls); }
    public Optional<HttpConfig> http() { return Optional.ofNullable(http); }
    public Optional<WebSocketConfig> websocket() { return Optional.ofNullable(websocket); }

    /**
     * Applies the authorization token to every configured channel.
     */
    public ClientConfig withAuth(String token) {
        return new ClientConfig(tls,
                http == null ? null : http.withAuth(token),
                websocket == null ? null : websocket.withAuth(token));
    }

    /**
     * Trusts the given certificate on both channels.
     *
     * @throws SmsClientException.InvalidConfig if the file is missing or not a .pem, .crt or .der file
     */
    public ClientConfig withCertificate(Path certificate) {
        return withTls(TlsConfig.of(certificate));
    }

    public ClientConfig withTls(TlsConfig tls) {
        return new ClientConfig(tls, http, websocket);
    }

    public ClientConfig withHttp(HttpConfig http) {
        return new ClientConfig(tls, http, websocket);
    }

    public ClientConfig withWebSocket(WebSocketConfig websocket) {
        return new ClientConfig(tls, http, websocket);
    }

    /**
     * Reads a configuration from {@code sms.}-prefixed properties. Durations use ISO-8601 ({@code PT5S}).
     *
     * <ul>
     *   <li>{@code sms.http.url}, {@code sms.http.auth}, {@code sms.http.base-timeout}, {@code sms.http.modem-timeout}</li>
     *   <li>{@code sms.ws.url}, {@code sms.ws.auth}, {@code sms.ws.auto-reconnect}, {@code sms.ws.reconnect-interval},
     *       {@code sms.ws.max-reconnect-interval}, {@code sms.ws.ping-interval}, {@code sms.ws.ping-timeout},
     *       {@code sms.ws.connect-timeout}, {@code sms.ws.max-reconnect-attempts},
     *       {@code sms.ws.events} (comma separated)</li>
     *   <li>{@code sms.auth}: applied to both channels unless a per-channel value is set</li>
     *   <li>{@code sms.tls.certificate}</li>
     * </ul>
     *
     * @throws SmsClientException.InvalidConfig if a value is malformed or neither URL is set
     */
    public static ClientConfig fromProperties(Properties props) {
        String sharedAuth = value(props, "auth");

        HttpConfig http = null;
        String httpUrl = value(props, "http.url");
        if (httpUrl != null) {
            HttpConfig.Builder b = HttpConfig.builder(httpUrl)
                    .authorization(firstNonNull(value(props, "http.auth"), sharedAuth));
            Duration base = duration(props, "http.base-timeout");
            if (base != null) b.baseTimeout(base);
            Duration modem = duration(props, "http.modem-timeout");
            if (modem != null) b.modemTimeout(modem);
            http = b.build();
        }

        WebSocketConfig websocket = null;
        String wsUrl = value(props, "ws.url");
        if (wsUrl != null) {
            WebSocketConfig.Builder b = WebSocketConfig.builder(wsUrl)
                    .authorization(firstNonNull(value(props, "ws.auth"), sharedAuth));
            String autoReconnect = value(props, "ws.auto-reconnect");
            if (autoReconnect != null) b.autoReconnect(parseBoolean("ws.auto-reconnect", autoReconnect));
            Duration d;
            if ((d = duration(props, "ws.reconnect-interval")) != null) b.reconnectInterval(d);
            if ((d = duration(props, "ws.max-reconnect-interval")) != null) b.maxReconnectInterval(d);
            if ((d = duration(props, "ws.ping-interval")) != null) b.pingInterval(d);
            if ((d = duration(props, "ws.ping-timeout")) != null) b.pingTimeout(d);
            if ((d = duration(props, "ws.connect-timeout")) != null) b.connectTimeout(d);
            String maxAttempts = value(props, "ws.max-reconnect-attempts");
            if (maxAttempts != null) b.maxReconnectAttempts(parseInt("ws.max-reconnect-attempts", maxAttempts));
            String events = value(props, "ws.events");
            if (events != null) b.filteredEvents(splitList(events));
            websocket = b.build();
        }

        ClientConfig config = new ClientConfig(null, http, websocket);
        String certificate = value(props, "tls.certificate");
        return certificate == null ? config : config.withCertificate(Path.of(certificate));
    }

    @Override
    public String toString() {
        return "ClientConfig{tls=" + tls + ", http=" + http + ", websocket=" + websocket + "}";
    }

    private static String value(Properties props, String key) {
        String v = props.getProperty(PREFIX + key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static Duration duration(Properties props, String key) {
        String v = value(props, key);
        if (v == null) return null;
        try {
            return Duration.parse(v);
        } catch (DateTimeParseException e) {
            throw new SmsClientException.InvalidConfig("Invalid duration for " + PREFIX + key + ": " + v, e);
        }
    }

    private static boolean parseBoolean(String key, String v) {
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new SmsClientException.InvalidConfig("Invalid boolean for " + PREFIX + key + ": " + v);
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new SmsClientException.InvalidConfig("Invalid integer for " + PREFIX + key + ": " + v, e);
        }
    }

    private static List<String> splitList(String v) {
        return Arrays.stream(v.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
