package io.smsclient.client;

import io.smsclient.client.http.SmsHttpClient;
import io.smsclient.client.ws.BackgroundConnection;
import io.smsclient.client.ws.GatewayEventListener;
import io.smsclient.client.ws.WebSocketClient;
import io.smsclient.core.ClientConfig;
import io.smsclient.core.SmsClientException;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point bundling the HTTP command client and the event channel client built from one {@link ClientConfig}.
 *
 * <pre>{@code
 * SmsClient client = SmsClient.create(ClientConfig.both("http://gateway:3000", "ws://gateway:3000/ws")
 *         .withAuth("token"));
 * client.onMessage(event -> log.info("{}", event));
 * client.startBackground();
 * String version = client.http().getVersion();
 * }</pre>
 */
public final class SmsClient {

    private final ClientConfig config;
    private final SmsHttpClient http;
    private final WebSocketClient websocket;

    SmsClient(ClientConfig config, SmsHttpClient http, WebSocketClient websocket) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = http;
        this.websocket = websocket;
    }

    /**
     * Builds a client with the default JDK transports and the JSON codec found on the classpath.
     *
     * @throws SmsClientException.InvalidConfig if the TLS certificate cannot be loaded
     */
    public static SmsClient create(ClientConfig config) {
        return builder(config).build();
    }

    public static SmsClientBuilder builder(ClientConfig config) {
        return new SmsClientBuilder(config);
    }

    public ClientConfig config() {
        return config;
    }

    /**
     * @throws SmsClientException.ComponentNotConfigured if the config has no HTTP part
     */
    public SmsHttpClient http() {
        if (http == null) {
            throw new SmsClientException.ComponentNotConfigured("HTTP");
        }
        return http;
    }

    public Optional<SmsHttpClient> httpIfConfigured() {
        return Optional.ofNullable(http);
    }

    /**
     * @throws SmsClientException.ComponentNotConfigured if the config has no WebSocket part
     */
    public WebSocketClient websocket() {
        if (websocket == null) {
            throw new SmsClientException.ComponentNotConfigured("WebSocket");
        }
        return websocket;
    }

    public Optional<WebSocketClient> websocketIfConfigured() {
        return Optional.ofNullable(websocket);
    }

    /** @see WebSocketClient#onMessage(GatewayEventListener) */
    public void onMessage(GatewayEventListener listener) {
        websocket().onMessage(listener);
    }

    /** @see WebSocketClient#startBlocking() */
    public void startBlocking() {
        websocket().startBlocking();
    }

    /** @see WebSocketClient#startBackground() */
    public BackgroundConnection startBackground() {
        return websocket().startBackground();
    }

    /** Stops the event connection, if one is configured and running. */
    public void stop() {
        if (websocket != null) {
            websocket.stop();
        }
    }

    /** @see WebSocketClient#reconnect() */
    public void reconnect() {
        websocket().reconnect();
    }

    public boolean isConnected() {
        return websocket != null && websocket.isConnected();
    }
}
