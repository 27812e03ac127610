package io.smsclient.transport.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * A request or WebSocket handshake did not finish within its deadline.
 * Modem queries routinely run long, so callers retry these differently from hard failures.
 */
public class HttpTimeoutException extends HttpClientException {

    private final Duration timeout;

    public HttpTimeoutException(String message) {
        super(message);
        this.timeout = null;
    }

    /**
     * @param target the URI being contacted
     * @param timeout the deadline that expired, or {@code null} when the adapter's default applied
     * @param cause the library's own timeout signal
     */
    public HttpTimeoutException(URI target, Duration timeout, Throwable cause) {
        super(target, timeout == null ? "Timed out" : "Timed out after " + timeout, cause);
        this.timeout = timeout;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }
}
