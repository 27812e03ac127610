package io.smsclient.json.spi;

import java.util.Optional;

/**
 * A gateway payload could not be encoded or decoded.
 * When the failure sits at a known place in the document, {@link #pointer()} names it.
 */
public class JsonException extends Exception {

    private final String pointer;

    public JsonException(String message) {
        this(message, null);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
        this.pointer = null;
    }

    private JsonException(String pointer, String message, Throwable cause) {
        super(message + " at " + pointer, cause);
        this.pointer = pointer;
    }

    /** Failure located at a JSON pointer such as {@code /data/message_id}. */
    public static JsonException at(String pointer, String message) {
        return new JsonException(pointer, message, null);
    }

    public static JsonException at(String pointer, String message, Throwable cause) {
        return new JsonException(pointer, message, cause);
    }

    public Optional<String> pointer() {
        return Optional.ofNullable(pointer);
    }
}
