package io.smsclient.client.ws;

import java.time.Duration;

/**
 * Delay before a reconnection attempt.
 */
@FunctionalInterface
public interface ReconnectBackoff {

    /**
     * @param attempt the 1-based number of consecutive failed attempts
     */
    Duration delayFor(int attempt);
}
