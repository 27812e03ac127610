package io.smsclient.transport.spi;

import java.net.URI;
import java.util.Optional;

/**
 * The gateway could not be reached or the exchange broke off: refused connection,
 * rejected certificate, reset socket or a failed WebSocket upgrade.
 *
 * <p>Adapters attach the URI they were talking to when they know it, so that a
 * caller juggling the REST and event channels can tell which one failed.
 */
public class HttpClientException extends Exception {

    private final URI target;

    public HttpClientException(String message) {
        this(null, message, null);
    }

    public HttpClientException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public HttpClientException(URI target, String message, Throwable cause) {
        super(target == null ? message : message + ": " + target, cause);
        this.target = target;
    }

    /** The gateway URI that was being contacted, if recorded. */
    public Optional<URI> target() {
        return Optional.ofNullable(target);
    }
}
