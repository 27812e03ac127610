package io.smsclient.client.ws;

import io.smsclient.core.GatewayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the single registered {@link GatewayEventListener} and delivers events to it.
 *
 * <p>Registering replaces the previous listener. Deliveries are serialized: an event is delivered to the
 * listener read at dispatch time, so a listener swapped mid-delivery receives only later events.
 */
public final class DispatchRegistry {

    private static final Logger log = LoggerFactory.getLogger(DispatchRegistry.class);

    private final AtomicReference<GatewayEventListener> slot = new AtomicReference<>();
    private final ReentrantLock deliveryLock = new ReentrantLock();

    /**
     * @param listener the new listener, or {@code null} to drop subsequent events
     * @return the replaced listener, or {@code null}
     */
    public GatewayEventListener register(GatewayEventListener listener) {
        return slot.getAndSet(listener);
    }

    public boolean hasListener() {
        return slot.get() != null;
    }

    /**
     * Delivers {@code event} to the current listener. Listener failures are logged, never propagated.
     *
     * @return true if a listener received the event
     */
    public boolean dispatch(GatewayEvent event) {
        deliveryLock.lock();
        try {
            GatewayEventListener listener = slot.get();
            if (listener == null) {
                log.trace("No listener registered, dropping {}", event.getClass().getSimpleName());
                return false;
            }
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {}", event.getClass().getSimpleName(), e);
            }
            return true;
        } finally {
            deliveryLock.unlock();
        }
    }
}
