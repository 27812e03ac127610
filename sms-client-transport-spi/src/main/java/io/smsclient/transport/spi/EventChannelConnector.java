package io.smsclient.transport.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Opens {@link EventChannel}s; the WebSocket counterpart of {@link HttpClientAdapter}.
 *
 * <p>Implementations should be thread-safe and reusable.
 */
public interface EventChannelConnector {

    /**
     * Performs the upgrade handshake.
     *
     * @param uri the {@code ws://} or {@code wss://} endpoint, query included
     * @param headers extra handshake headers
     * @param timeout handshake timeout
     * @return the open channel
     * @throws HandshakeException if the server rejected the upgrade with an HTTP status
     * @throws HttpTimeoutException if the handshake did not finish within {@code timeout}
     * @throws HttpClientException for any other connection failure
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    EventChannel connect(URI uri, Map<String, String> headers, Duration timeout)
            throws HttpClientException, InterruptedException;
}
