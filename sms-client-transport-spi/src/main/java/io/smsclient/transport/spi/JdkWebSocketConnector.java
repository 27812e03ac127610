package io.smsclient.transport.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link EventChannelConnector} implementation using the JDK 11+ WebSocket client.
 * This is the default implementation when no other connector is configured.
 */
public final class JdkWebSocketConnector implements EventChannelConnector {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;

    public JdkWebSocketConnector(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static JdkWebSocketConnector create() {
        return new JdkWebSocketConnector(JdkHttpClientAdapter.newHttpClient(null));
    }

    /**
     * @param sslContext the TLS context for {@code wss://} endpoints, or {@code null} for the platform default
     */
    public static JdkWebSocketConnector create(SSLContext sslContext) {
        return new JdkWebSocketConnector(JdkHttpClientAdapter.newHttpClient(sslContext));
    }

    @Override
    public EventChannel connect(URI uri, Map<String, String> headers, Duration timeout)
            throws HttpClientException, InterruptedException {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(timeout, "timeout");

        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(timeout);
        if (headers != null) {
            headers.forEach(builder::header);
        }

        QueueingListener listener = new QueueingListener();
        CompletableFuture<WebSocket> pending = builder.buildAsync(uri, listener);
        try {
            WebSocket webSocket = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new JdkEventChannel(webSocket, listener);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new HttpTimeoutException(uri, timeout, e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw translate(uri, e.getCause());
        }
    }

    private static HttpClientException translate(URI uri, Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof WebSocketHandshakeException handshake) {
            return new HandshakeException(handshake.getResponse().statusCode(), handshake);
        }
        if (cause instanceof java.net.http.HttpTimeoutException) {
            return new HttpTimeoutException(uri, null, cause);
        }
        return new HttpClientException(uri, "WebSocket connection failed", cause);
    }

    /** Inbound item: a complete text message or the terminal close. */
    private record Inbound(String text, ChannelClosedException closed) {}

    /**
     * Collects frames into whole messages. Demand is one message: a new one is requested only after the
     * reader takes the previous one, control frames and partial text are always followed by a new request.
     */
    private static final class QueueingListener implements WebSocket.Listener {
        private final BlockingQueue<Inbound> queue = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();
        private volatile long lastActivityNanos = System.nanoTime();

        @Override
        public void onOpen(WebSocket webSocket) {
            lastActivityNanos = System.nanoTime();
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            lastActivityNanos = System.nanoTime();
            partial.append(data);
            if (last) {
                queue.add(new Inbound(partial.toString(), null));
                partial.setLength(0);
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            lastActivityNanos = System.nanoTime();
            log.debug("Ignoring binary frame of {} bytes", data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            // The JDK client answers pings itself.
            lastActivityNanos = System.nanoTime();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            lastActivityNanos = System.nanoTime();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            queue.add(new Inbound(null, new ChannelClosedException(statusCode, reason)));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            queue.add(new Inbound(null, new ChannelClosedException("WebSocket failed: " + error, error)));
        }
    }

    private static final class JdkEventChannel implements EventChannel {
        private static final Duration CLOSE_GRACE = Duration.ofSeconds(1);

        private final WebSocket webSocket;
        private final QueueingListener listener;
        private ChannelClosedException terminal;

        JdkEventChannel(WebSocket webSocket, QueueingListener listener) {
            this.webSocket = webSocket;
            this.listener = listener;
        }

        @Override
        public String receive(Duration timeout) throws ChannelClosedException, InterruptedException {
            if (terminal != null) {
                throw terminal;
            }
            Inbound next = listener.queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (next == null) {
                return null;
            }
            if (next.closed() != null) {
                terminal = next.closed();
                throw terminal;
            }
            webSocket.request(1);
            return next.text();
        }

        @Override
        public void ping() throws ChannelClosedException {
            if (webSocket.isOutputClosed()) {
                throw new ChannelClosedException(ChannelClosedException.NO_STATUS, "output closed");
            }
            webSocket.sendPing(ByteBuffer.allocate(0)).whenComplete((ws, error) -> {
                if (error != null) {
                    listener.queue.add(new Inbound(null, new ChannelClosedException("Ping failed: " + error, error)));
                }
            });
        }

        @Override
        public long idleNanos() {
            return System.nanoTime() - listener.lastActivityNanos;
        }

        @Override
        public void close() {
            if (webSocket.isOutputClosed()) {
                return;
            }
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "")
                    .orTimeout(CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ws, error) -> {
                        if (error != null) {
                            log.debug("Close handshake did not complete, aborting: {}", error.toString());
                            webSocket.abort();
                        }
                    });
        }

        @Override
        public void abort() {
            webSocket.abort();
            listener.queue.add(new Inbound(null, new ChannelClosedException(ChannelClosedException.NO_STATUS, "aborted")));
        }
    }
}
