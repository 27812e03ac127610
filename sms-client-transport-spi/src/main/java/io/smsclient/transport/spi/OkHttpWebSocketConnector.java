package io.smsclient.transport.spi;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link EventChannelConnector} implementation using OkHttp.
 *
 * <p>OkHttp sends keepalive pings on its own schedule and fails the socket when a pong is missed,
 * so channels from this connector ignore {@link EventChannel#ping()} and report zero idle time.
 *
 * <p>OkHttp pushes messages from its own reader thread. That thread is held in {@code onMessage} while a
 * message is still waiting for {@link EventChannel#receive}, so at most one message is read ahead and the
 * socket is not drained faster than the reader consumes it. A reader stalled for longer than the ping
 * interval also holds back pongs, and OkHttp then fails the channel.
 */
public final class OkHttpWebSocketConnector implements EventChannelConnector {

    private static final Logger log = LoggerFactory.getLogger(OkHttpWebSocketConnector.class);

    private final OkHttpClient httpClient;

    public OkHttpWebSocketConnector(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpWebSocketConnector create(Duration pingInterval) {
        return new OkHttpWebSocketConnector(new OkHttpClient.Builder()
                .pingInterval(pingInterval.toMillis(), TimeUnit.MILLISECONDS)
                .build());
    }

    @Override
    public EventChannel connect(URI uri, Map<String, String> headers, Duration timeout)
            throws HttpClientException, InterruptedException {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(timeout, "timeout");

        // OkHttp expects http(s) URLs for the upgrade request.
        String url = uri.toString().replaceFirst("^ws:", "http:").replaceFirst("^wss:", "https:");
        Request.Builder request = new Request.Builder().url(url);
        if (headers != null) {
            headers.forEach(request::header);
        }

        OkHttpClient client = httpClient.newBuilder()
                .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .build();

        HandOffListener listener = new HandOffListener();
        WebSocket webSocket = client.newWebSocket(request.build(), listener);
        try {
            listener.opened.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new OkHttpEventChannel(webSocket, listener);
        } catch (TimeoutException e) {
            webSocket.cancel();
            throw new HttpTimeoutException(uri, timeout, e);
        } catch (InterruptedException e) {
            webSocket.cancel();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpClientException hce) {
                throw hce;
            }
            throw new HttpClientException(uri, "WebSocket connection failed", cause);
        }
    }

    private static final class HandOffListener extends WebSocketListener {
        private final CompletableFuture<Void> opened = new CompletableFuture<>();
        private final MessageSlot slot = new MessageSlot();

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.complete(null);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            try {
                if (!slot.put(text)) {
                    log.trace("Channel closed, dropping message");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                webSocket.cancel();
                slot.close(new ChannelClosedException("WebSocket reader interrupted", e), true);
            }
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(code, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            slot.close(new ChannelClosedException(code, reason), false);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (!opened.isDone()) {
                if (response != null && response.code() != 101) {
                    opened.completeExceptionally(new HandshakeException(response.code(), t));
                } else {
                    opened.completeExceptionally(new HttpClientException("WebSocket connection failed", t));
                }
                return;
            }
            slot.close(new ChannelClosedException("WebSocket failed: " + t, t), false);
        }
    }

    private static final class OkHttpEventChannel implements EventChannel {
        private final WebSocket webSocket;
        private final HandOffListener listener;

        OkHttpEventChannel(WebSocket webSocket, HandOffListener listener) {
            this.webSocket = webSocket;
            this.listener = listener;
        }

        @Override
        public String receive(Duration timeout) throws ChannelClosedException, InterruptedException {
            return listener.slot.take(timeout);
        }

        @Override
        public void ping() {
            // keepalive is handled by OkHttpClient.pingInterval
        }

        @Override
        public long idleNanos() {
            return 0;
        }

        @Override
        public void close() {
            if (!webSocket.close(1000, null)) {
                log.debug("WebSocket already closing");
            }
        }

        @Override
        public void abort() {
            listener.slot.close(new ChannelClosedException(ChannelClosedException.NO_STATUS, "aborted"), true);
            webSocket.cancel();
        }
    }
}
