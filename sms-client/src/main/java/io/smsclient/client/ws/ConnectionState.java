package io.smsclient.client.ws;

/**
 * Lifecycle states of an {@link EventConnection}.
 *
 * <pre>
 * IDLE -> CONNECTING -> OPEN -> RECONNECTING -> CONNECTING -> ...
 *   any state -> CLOSED (terminal)
 * </pre>
 */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    OPEN,
    RECONNECTING,
    CLOSED
}
