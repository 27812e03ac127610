package io.smsclient.core;

/**
 * Base class for SMS client runtime errors.
 *
 * <p>Covers connection lifecycle failures, driver misuse and configuration problems.
 * Subclasses are specific to the error condition while preserving the original cause when applicable.
 * Request-level failures of the HTTP command channel and pagination use checked exceptions instead.
 */
public abstract class SmsClientException extends RuntimeException {

    protected SmsClientException(String message) {
        super(message);
    }

    protected SmsClientException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the event channel could not be opened (DNS, TLS, refused, handshake failure).
     */
    public static class ConnectionFailed extends SmsClientException {
        public ConnectionFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when an open event channel was closed by the remote side, failed with an I/O error,
     * or stopped answering pings.
     */
    public static class ChannelClosed extends SmsClientException {
        public ChannelClosed(String message) {
            super(message);
        }

        public ChannelClosed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the gateway rejected the event channel handshake with HTTP 401.
     * Never retried.
     */
    public static class Unauthorized extends SmsClientException {
        public Unauthorized(String message) {
            super(message);
        }
    }

    /**
     * Raised when a connection or driver is started while another one is still running.
     */
    public static class AlreadyRunning extends SmsClientException {
        public AlreadyRunning(String message) {
            super(message);
        }
    }

    /**
     * Raised when an operation needs a running connection and there is none.
     */
    public static class NotRunning extends SmsClientException {
        public NotRunning(String message) {
            super(message);
        }
    }

    /**
     * Raised when a configuration value is missing or invalid.
     */
    public static class InvalidConfig extends SmsClientException {
        public InvalidConfig(String message) {
            super(message);
        }

        public InvalidConfig(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised by a component accessor when the client was built without that component.
     */
    public static class ComponentNotConfigured extends SmsClientException {
        public ComponentNotConfigured(String component) {
            super("No " + component + " client configured");
        }
    }
}
