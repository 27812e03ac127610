package io.smsclient.client;

import io.smsclient.client.http.SmsHttpClient;
import io.smsclient.client.ws.ReconnectBackoff;
import io.smsclient.client.ws.WebSocketClient;
import io.smsclient.core.ClientConfig;
import io.smsclient.core.SmsClientException;
import io.smsclient.core.TlsConfig;
import io.smsclient.json.spi.JsonCodec;
import io.smsclient.json.spi.JsonCodecs;
import io.smsclient.transport.spi.EventChannelConnector;
import io.smsclient.transport.spi.HttpClientAdapter;
import io.smsclient.transport.spi.JdkHttpClientAdapter;
import io.smsclient.transport.spi.JdkWebSocketConnector;
import io.smsclient.transport.spi.TlsContexts;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * Builds an {@link SmsClient}. Transports and codec default to the JDK HttpClient and WebSocket
 * and to the {@link JsonCodec} registered on the classpath.
 */
public final class SmsClientBuilder {
    private final ClientConfig config;
    private HttpClientAdapter httpAdapter;
    private EventChannelConnector connector;
    private JsonCodec codec;
    private ReconnectBackoff backoff;

    SmsClientBuilder(ClientConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public SmsClientBuilder httpAdapter(HttpClientAdapter httpAdapter) {
        this.httpAdapter = Objects.requireNonNull(httpAdapter, "httpAdapter");
        return this;
    }

    public SmsClientBuilder connector(EventChannelConnector connector) {
        this.connector = Objects.requireNonNull(connector, "connector");
        return this;
    }

    public SmsClientBuilder codec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    public SmsClientBuilder backoff(ReconnectBackoff backoff) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        return this;
    }

    /**
     * @throws SmsClientException.InvalidConfig if the configured certificate cannot be loaded
     * @throws IllegalStateException if no codec was given and none is registered
     */
    public SmsClient build() {
        JsonCodec resolvedCodec = codec != null ? codec : JsonCodecs.load();
        SSLContext sslContext = (httpAdapter == null || connector == null)
                ? config.tls().map(SmsClientBuilder::sslContext).orElse(null)
                : null;

        SmsHttpClient http = config.http()
                .map(c -> new SmsHttpClient(c,
                        httpAdapter != null ? httpAdapter : JdkHttpClientAdapter.create(sslContext),
                        resolvedCodec))
                .orElse(null);

        WebSocketClient websocket = config.websocket()
                .map(c -> {
                    EventChannelConnector resolved = connector != null ? connector : JdkWebSocketConnector.create(sslContext);
                    return backoff != null
                            ? new WebSocketClient(c, resolved, resolvedCodec, backoff)
                            : new WebSocketClient(c, resolved, resolvedCodec);
                })
                .orElse(null);

        return new SmsClient(config, http, websocket);
    }

    private static SSLContext sslContext(TlsConfig tls) {
        try {
            return TlsContexts.fromCertificate(tls.certificate());
        } catch (IOException | GeneralSecurityException e) {
            throw new SmsClientException.InvalidConfig("Failed to load certificate " + tls.certificate(), e);
        }
    }
}
