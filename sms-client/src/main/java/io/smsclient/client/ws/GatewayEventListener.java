package io.smsclient.client.ws;

import io.smsclient.core.GatewayEvent;

/**
 * Receives gateway events, one at a time, on the connection's reader thread.
 *
 * <p>The next message is not read until {@link #onEvent} returns, so slow work (network calls,
 * notifications, database writes) must be handed off to an executor.
 * An exception thrown from {@code onEvent} is logged and the connection keeps running.
 */
@FunctionalInterface
public interface GatewayEventListener {

    void onEvent(GatewayEvent event);
}
