package io.smsclient.transport.spi;

/**
 * The event channel is no longer usable: the peer closed it, the transport failed, or it was closed locally.
 */
public class ChannelClosedException extends Exception {

    /** Close code used when there was no close frame. */
    public static final int NO_STATUS = -1;

    private final int closeCode;

    public ChannelClosedException(int closeCode, String reason) {
        super("Channel closed (" + closeCode + ")" + (reason == null || reason.isEmpty() ? "" : ": " + reason));
        this.closeCode = closeCode;
    }

    public ChannelClosedException(String message, Throwable cause) {
        super(message, cause);
        this.closeCode = NO_STATUS;
    }

    public int closeCode() {
        return closeCode;
    }
}
