package io.smsclient.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Gateway URL helpers: route resolution, query building and parsing of configured URLs.
 */
public final class Urls {
    private Urls() {}

    /**
     * Appends form-encoded parameters in key order, after any query the base already has.
     * Null values are skipped.
     */
    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null) return base;
        String query = new TreeMap<>(params).entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        if (query.isEmpty()) return base;
        return URI.create(base + (base.getRawQuery() == null ? "?" : "&") + query);
    }

    /**
     * Resolves an absolute route (e.g. {@code /sms/send}) against the gateway base URL,
     * replacing any path the base URL carries.
     */
    public static URI route(URI base, String route) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(route, "route");
        return base.resolve(route);
    }

    /**
     * Parses a configured URL, mapping syntax errors to {@link SmsClientException.InvalidConfig}.
     */
    public static URI parse(String url, String what) {
        if (url == null || url.isBlank()) {
            throw new SmsClientException.InvalidConfig(what + " must not be blank");
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new SmsClientException.InvalidConfig(what + " must be an absolute URL: " + url);
            }
            return uri;
        } catch (java.net.URISyntaxException e) {
            throw new SmsClientException.InvalidConfig(what + " is not a valid URL: " + url, e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
