package io.smsclient.client.ws;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to an event connection running on a background thread.
 */
public final class BackgroundConnection {

    private final EventConnection connection;
    private final Thread thread;

    BackgroundConnection(EventConnection connection, Thread thread) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.thread = Objects.requireNonNull(thread, "thread");
    }

    /** Stops the connection; returns without waiting for the background thread. */
    public void stop() {
        connection.stop();
    }

    public ConnectionState state() {
        return connection.state();
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public String threadName() {
        return thread.getName();
    }

    /**
     * Completes normally after a stop, exceptionally with the terminal error otherwise.
     */
    public CompletableFuture<Void> termination() {
        return connection.termination();
    }

    /**
     * Waits for the connection to terminate, however it ends.
     *
     * @return true if it terminated within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        try {
            connection.termination().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (ExecutionException e) {
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }
}
