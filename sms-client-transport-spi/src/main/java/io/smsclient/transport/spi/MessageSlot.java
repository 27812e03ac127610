package io.smsclient.transport.spi;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-message hand-off between a push-style transport thread and the channel reader.
 *
 * <p>{@link #put} blocks while a message is waiting, so the transport stops reading from the socket until
 * the reader catches up. The terminal close travels separately and never blocks.
 */
final class MessageSlot {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private String pending;
    private ChannelClosedException closed;

    /**
     * Hands over {@code text}, waiting until the previous message was taken.
     *
     * @return false if the slot was closed first and the message dropped
     */
    boolean put(String text) throws InterruptedException {
        lock.lock();
        try {
            while (pending != null && closed == null) {
                changed.await();
            }
            if (closed != null) {
                return false;
            }
            pending = text;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the terminal close. A waiting message is still delivered first unless {@code discard} is set.
     * Only the first close counts.
     */
    void close(ChannelClosedException reason, boolean discard) {
        lock.lock();
        try {
            if (closed == null) {
                closed = reason;
            }
            if (discard) {
                pending = null;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the next message, or {@code null} if none arrived within {@code timeout}
     * @throws ChannelClosedException once the slot is closed and drained
     */
    String take(Duration timeout) throws ChannelClosedException, InterruptedException {
        lock.lock();
        try {
            long nanos = timeout.toNanos();
            while (pending == null && closed == null) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = changed.awaitNanos(nanos);
            }
            if (pending != null) {
                String text = pending;
                pending = null;
                changed.signalAll();
                return text;
            }
            throw closed;
        } finally {
            lock.unlock();
        }
    }
}
