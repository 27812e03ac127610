package io.smsclient.client.ws;

import io.smsclient.core.GatewayEvent;
import io.smsclient.core.Protocol;
import io.smsclient.core.SmsClientException;
import io.smsclient.core.WebSocketConfig;
import io.smsclient.json.spi.JsonException;
import io.smsclient.transport.spi.ChannelClosedException;
import io.smsclient.transport.spi.EventChannel;
import io.smsclient.transport.spi.EventChannelConnector;
import io.smsclient.transport.spi.HandshakeException;
import io.smsclient.transport.spi.HttpClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One run of the event channel: connect, read and dispatch, reconnect on failure, until stopped or failed for good.
 *
 * <p>{@link #run()} drives the whole lifecycle on the calling thread. {@link #stop()} and {@link #reconnect()}
 * may be called from any thread, including from inside a listener. A connection runs once; after it reaches
 * {@link ConnectionState#CLOSED} a new one must be created.
 *
 * <p>Internal implementation; clients use {@link WebSocketClient}.
 */
public final class EventConnection {

    private static final Logger log = LoggerFactory.getLogger(EventConnection.class);

    private static final int MAX_LOGGED_FRAME = 256;

    private final WebSocketConfig config;
    private final EventChannelConnector connector;
    private final GatewayEventDecoder decoder;
    private final DispatchRegistry registry;
    private final ReconnectBackoff backoff;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.IDLE);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicReference<EventChannel> reconnectTarget = new AtomicReference<>();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private volatile EventChannel channel;
    private volatile int retryCount;

    public EventConnection(WebSocketConfig config,
                           EventChannelConnector connector,
                           GatewayEventDecoder decoder,
                           DispatchRegistry registry,
                           ReconnectBackoff backoff) {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    public ConnectionState state() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.OPEN;
    }

    /** Consecutive failed attempts since the last successful connect. */
    public int retryCount() {
        return retryCount;
    }

    /**
     * Completes when the connection reaches {@link ConnectionState#CLOSED}: normally after {@link #stop()},
     * exceptionally with the terminal {@link SmsClientException} otherwise.
     */
    public CompletableFuture<Void> termination() {
        return termination.copy();
    }

    /**
     * Runs the connection on the calling thread until it is closed.
     *
     * <p>Returns normally if the connection was stopped while running. Any other throwable escaping the loop,
     * including an {@link Error} from a listener, still closes the connection and completes
     * {@link #termination()} exceptionally before it propagates.
     *
     * @throws SmsClientException.AlreadyRunning if this connection was already run or stopped before it ran
     * @throws SmsClientException.Unauthorized if the gateway rejected the handshake with 401
     * @throws SmsClientException.ConnectionFailed if connecting failed and no reconnect is allowed
     * @throws SmsClientException.ChannelClosed if the channel was lost and no reconnect is allowed
     */
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new SmsClientException.AlreadyRunning("Connection already started");
        }
        if (!state.compareAndSet(ConnectionState.IDLE, ConnectionState.CONNECTING)) {
            throw new SmsClientException.AlreadyRunning("Connection was stopped before it started");
        }

        SmsClientException failure;
        try {
            failure = loop();
        } catch (Throwable t) {
            // a listener Error or a bug in the loop still has to release the channel and the client
            EventChannel ch = channel;
            if (ch != null) {
                ch.abort();
            }
            finish(t);
            throw t;
        }
        finish(failure);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Stops the connection: wakes a pending backoff, drops the open channel and moves to CLOSED.
     * Idempotent.
     */
    public void stop() {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.CLOSED) {
            return;
        }
        log.debug("Stopping connection (was {})", previous);
        stopSignal.countDown();
        if (previous == ConnectionState.IDLE) {
            termination.complete(null);
            return;
        }
        EventChannel ch = channel;
        if (ch != null) {
            ch.abort();
        }
    }

    /**
     * Drops the open channel and reconnects, even when auto-reconnect is disabled.
     * A no-op while a connect or backoff is already in progress.
     *
     * @throws SmsClientException.NotRunning if the connection is not running
     */
    public void reconnect() {
        ConnectionState current = state.get();
        if (current == ConnectionState.IDLE || current == ConnectionState.CLOSED) {
            throw new SmsClientException.NotRunning("Connection is not running (state " + current + ")");
        }
        EventChannel ch = channel;
        if (current == ConnectionState.OPEN && ch != null) {
            log.debug("Forcing reconnect");
            reconnectTarget.set(ch);
            ch.abort();
        }
    }

    private SmsClientException loop() {
        Map<String, String> headers = config.authorization()
                .map(token -> Map.of(Protocol.H_AUTHORIZATION, token))
                .orElse(Map.of());

        while (!stopping()) {
            EventChannel ch;
            try {
                log.debug("Connecting to {}", config.url());
                ch = connector.connect(config.connectUrl(), headers, config.connectTimeout());
            } catch (HandshakeException e) {
                if (e.isUnauthorized()) {
                    log.debug("Gateway rejected the handshake: unauthorized");
                    return new SmsClientException.Unauthorized("Event channel authorization rejected by " + config.url());
                }
                SmsClientException failure = connectFailed(e);
                if (!awaitReconnect(null)) return stopping() ? null : failure;
                continue;
            } catch (HttpClientException e) {
                SmsClientException failure = connectFailed(e);
                if (!awaitReconnect(null)) return stopping() ? null : failure;
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stop();
                return null;
            }

            channel = ch;
            if (!transition(ConnectionState.OPEN)) {
                ch.close();
                channel = null;
                return null;
            }
            retryCount = 0;
            log.debug("Connected to {}", config.url());
            registry.dispatch(new GatewayEvent.ConnectionUpdate(true, false));

            SmsClientException closed = readLoop(ch);
            channel = null;
            if (closed == null) {
                registry.dispatch(new GatewayEvent.ConnectionUpdate(false, false));
                return null;
            }
            if (!awaitReconnect(ch)) return stopping() ? null : closed;
        }
        return null;
    }

    private SmsClientException connectFailed(HttpClientException e) {
        log.debug("Connection to {} failed: {}", config.url(), e.toString());
        return new SmsClientException.ConnectionFailed("Failed to connect to " + config.url(), e);
    }

    /**
     * Reads and dispatches frames until the channel is lost.
     *
     * @return the reason the channel was lost, or null if the connection was stopped
     */
    private SmsClientException readLoop(EventChannel ch) {
        long pingTimeoutNanos = config.pingTimeout().toNanos();
        while (!stopping()) {
            String text;
            try {
                text = ch.receive(config.pingInterval());
                if (text == null) {
                    if (ch.idleNanos() > pingTimeoutNanos) {
                        log.debug("No traffic from gateway for {}, dropping channel", config.pingTimeout());
                        ch.abort();
                        return new SmsClientException.ChannelClosed("Ping timeout after " + config.pingTimeout());
                    }
                    log.trace("Sending ping");
                    ch.ping();
                    continue;
                }
            } catch (ChannelClosedException e) {
                if (stopping()) {
                    return null;
                }
                log.debug("Channel lost: {}", e.getMessage());
                return new SmsClientException.ChannelClosed(e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stop();
                return null;
            }
            handleFrame(text);
        }
        return null;
    }

    private void handleFrame(String text) {
        GatewayEvent event;
        try {
            event = decoder.decode(text);
        } catch (JsonException e) {
            log.warn("Invalid event frame {}", abbreviate(text), e);
            return;
        }
        registry.dispatch(event);
    }

    /**
     * Emits the disconnect update and, if a reconnect is allowed, waits out the backoff.
     *
     * @return true to connect again, false to finish
     */
    private boolean awaitReconnect(EventChannel lost) {
        // a request aimed at an earlier channel is stale and dropped here
        EventChannel target = reconnectTarget.getAndSet(null);
        boolean forced = lost != null && target == lost;
        boolean attemptsLeft = config.maxReconnectAttempts().map(max -> retryCount < max).orElse(true);
        boolean willReconnect = !stopping() && (forced || (config.autoReconnect() && attemptsLeft));
        registry.dispatch(new GatewayEvent.ConnectionUpdate(false, willReconnect));
        if (!willReconnect || !transition(ConnectionState.RECONNECTING)) {
            return false;
        }

        int attempt = ++retryCount;
        Duration delay = forced ? Duration.ZERO : backoff.delayFor(attempt);
        log.debug("Reconnecting in {} (attempt {})", delay, attempt);
        try {
            if (stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            return false;
        }
        return transition(ConnectionState.CONNECTING);
    }

    /** Moves to {@code next} unless the connection was closed meanwhile. */
    private boolean transition(ConnectionState next) {
        while (true) {
            ConnectionState current = state.get();
            if (current == ConnectionState.CLOSED) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    private boolean stopping() {
        return stopSignal.getCount() == 0;
    }

    private void finish(Throwable failure) {
        state.set(ConnectionState.CLOSED);
        channel = null;
        if (failure == null) {
            log.debug("Connection terminated");
            termination.complete(null);
        } else {
            log.debug("Connection terminated: {}", failure.toString());
            termination.completeExceptionally(failure);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_LOGGED_FRAME ? text : text.substring(0, MAX_LOGGED_FRAME) + "...";
    }
}
