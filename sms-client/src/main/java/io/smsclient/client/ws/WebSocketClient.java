package io.smsclient.client.ws;

import io.smsclient.core.SmsClientException;
import io.smsclient.core.WebSocketConfig;
import io.smsclient.json.spi.JsonCodec;
import io.smsclient.transport.spi.EventChannelConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event channel client: registers the listener and runs the connection in the foreground or in the background.
 *
 * <p>At most one connection runs at a time. Once it is closed, starting again creates a fresh connection;
 * the registered listener carries over.
 *
 * <pre>{@code
 * WebSocketClient ws = new WebSocketClient(config, JdkWebSocketConnector.create(), JsonCodecs.load());
 * ws.onMessage(event -> {
 *     if (event instanceof GatewayEvent.IncomingMessage m) {
 *         executor.submit(() -> notify(m));
 *     }
 * });
 * BackgroundConnection conn = ws.startBackground();
 * }</pre>
 */
public final class WebSocketClient {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClient.class);

    private final WebSocketConfig config;
    private final EventChannelConnector connector;
    private final GatewayEventDecoder decoder;
    private final ReconnectBackoff backoff;
    private final DispatchRegistry registry = new DispatchRegistry();
    private final AtomicReference<EventConnection> active = new AtomicReference<>();

    public WebSocketClient(WebSocketConfig config, EventChannelConnector connector, JsonCodec codec) {
        this(config, connector, codec,
                new ExponentialReconnectBackoff(config.reconnectInterval(), config.maxReconnectInterval()));
    }

    public WebSocketClient(WebSocketConfig config, EventChannelConnector connector, JsonCodec codec,
                           ReconnectBackoff backoff) {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.decoder = new GatewayEventDecoder(Objects.requireNonNull(codec, "codec"));
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    public WebSocketConfig config() {
        return config;
    }

    /**
     * Sets the listener, replacing any previous one. Takes effect for the next dispatched event,
     * whether or not a connection is running.
     */
    public void onMessage(GatewayEventListener listener) {
        registry.register(listener);
    }

    /**
     * Runs the connection on the calling thread.
     *
     * <p>Returns normally once {@link #stop()} is called, from another thread or from the listener.
     *
     * @throws SmsClientException.AlreadyRunning if a connection is already running
     * @throws SmsClientException the terminal failure when the connection ends for any other reason
     */
    public void startBlocking() {
        claim().run();
    }

    /**
     * Runs the connection on a daemon thread named {@code sms-client-ws-N}.
     *
     * @throws SmsClientException.AlreadyRunning if a connection is already running
     */
    public BackgroundConnection startBackground() {
        EventConnection connection = claim();
        Thread thread = ConnectionThreadFactory.DEFAULT.newThread(() -> runInBackground(connection));
        thread.start();
        return new BackgroundConnection(connection, thread);
    }

    /** Stops the running connection, if any. */
    public void stop() {
        EventConnection connection = active.get();
        if (connection != null) {
            connection.stop();
        }
    }

    /**
     * Forces the running connection to reconnect.
     *
     * @throws SmsClientException.NotRunning if no connection is running
     */
    public void reconnect() {
        EventConnection connection = active.get();
        if (connection == null) {
            throw new SmsClientException.NotRunning("WebSocket client is not running");
        }
        connection.reconnect();
    }

    public boolean isConnected() {
        EventConnection connection = active.get();
        return connection != null && connection.isConnected();
    }

    public ConnectionState state() {
        EventConnection connection = active.get();
        return connection == null ? ConnectionState.IDLE : connection.state();
    }

    private EventConnection claim() {
        EventConnection fresh = new EventConnection(config, connector, decoder, registry, backoff);
        while (true) {
            EventConnection current = active.get();
            if (current != null && current.state() != ConnectionState.CLOSED) {
                throw new SmsClientException.AlreadyRunning("WebSocket client is already running");
            }
            if (active.compareAndSet(current, fresh)) {
                return fresh;
            }
        }
    }

    private static void runInBackground(EventConnection connection) {
        try {
            connection.run();
        } catch (SmsClientException e) {
            // also reported through BackgroundConnection.termination()
            log.warn("Event connection terminated: {}", e.getMessage());
        } catch (RuntimeException | Error e) {
            log.error("Event connection failed unexpectedly", e);
            throw e;
        }
    }
}
