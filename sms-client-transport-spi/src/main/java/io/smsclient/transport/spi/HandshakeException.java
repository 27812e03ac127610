package io.smsclient.transport.spi;

/**
 * The server answered the WebSocket upgrade with a non-101 status.
 */
public class HandshakeException extends HttpClientException {

    private final int statusCode;

    public HandshakeException(int statusCode, Throwable cause) {
        super("WebSocket handshake rejected with HTTP " + statusCode, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }
}
