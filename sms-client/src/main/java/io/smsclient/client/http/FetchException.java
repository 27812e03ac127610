package io.smsclient.client.http;

/**
 * A page could not be fetched. The paginator's position is unchanged, so calling it again retries the same page.
 */
public class FetchException extends Exception {

    private final long offset;

    public FetchException(long offset, Throwable cause) {
        super("Failed to fetch page at offset " + offset + ": " + cause.getMessage(), cause);
        this.offset = offset;
    }

    /** Offset of the page that failed. */
    public long offset() {
        return offset;
    }
}
