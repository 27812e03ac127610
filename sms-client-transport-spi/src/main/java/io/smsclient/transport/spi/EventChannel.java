package io.smsclient.transport.spi;

import java.time.Duration;

/**
 * An open, text-framed, bidirectional channel to the gateway.
 *
 * <p>Reads are pull-based: the transport delivers at most one message ahead of the reader.
 * {@link #receive}, {@link #ping} and {@link #idleNanos} are called from a single reader thread.
 * {@link #close} and {@link #abort} may be called from any thread.
 */
public interface EventChannel {

    /**
     * Waits for the next text message.
     *
     * @param timeout how long to wait
     * @return the message text, or {@code null} if none arrived within {@code timeout}
     * @throws ChannelClosedException if the channel was closed or failed; every later call throws too
     * @throws InterruptedException if the reader thread is interrupted
     */
    String receive(Duration timeout) throws ChannelClosedException, InterruptedException;

    /**
     * Sends a keepalive ping. Transports that keep the channel alive by themselves may ignore it.
     *
     * @throws ChannelClosedException if the channel is already closed
     */
    void ping() throws ChannelClosedException;

    /**
     * Nanoseconds since anything was last received, pongs included.
     * Transports that detect dead peers by themselves report 0.
     */
    long idleNanos();

    /**
     * Starts a graceful close; does not wait for the peer to acknowledge it.
     */
    void close();

    /**
     * Drops the connection immediately. Unblocks a pending {@link #receive}.
     */
    void abort();
}
