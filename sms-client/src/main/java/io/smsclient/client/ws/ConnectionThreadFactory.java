package io.smsclient.client.ws;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the daemon threads background connections run on, named {@code <prefix>1}, {@code <prefix>2}, ...
 * Numbering is shared by every client using the same factory.
 */
final class ConnectionThreadFactory implements ThreadFactory {

    static final ConnectionThreadFactory DEFAULT = new ConnectionThreadFactory("sms-client-ws-");

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    ConnectionThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    }
}
