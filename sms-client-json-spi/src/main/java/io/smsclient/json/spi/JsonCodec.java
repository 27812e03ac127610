package io.smsclient.json.spi;

import java.util.List;
import java.util.Optional;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap a specific JSON library.
 *
 * <p>Gateway envelopes nest their payload under a key that depends on the route, so besides whole-document
 * binding the codec can bind the value found at a JSON Pointer (RFC 6901), e.g. {@code /response/data}.
 * Field names on the wire are {@code snake_case}; implementations map them to Java's camel case.
 */
public interface JsonCodec {

    /**
     * Serializes an object to a JSON byte array. {@code null} record components are omitted.
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    /**
     * Deserializes JSON bytes to a typed object. Unknown properties are ignored.
     * @throws JsonException if the bytes are not valid JSON or do not bind to {@code type}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON string to a typed object.
     * @throws JsonException if the text is not valid JSON or does not bind to {@code type}
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Binds the value at {@code pointer}.
     *
     * @param data JSON document
     * @param pointer a JSON Pointer such as {@code /response}
     * @param type target class
     * @return the bound value, or empty when the pointer resolves to nothing or to {@code null}
     * @throws JsonException if the document is not valid JSON or the value does not bind to {@code type}
     */
    <T> Optional<T> readAt(byte[] data, String pointer, Class<T> type) throws JsonException;

    /**
     * Binds the JSON array at {@code pointer} to a list.
     *
     * @return the list, or empty when the pointer resolves to nothing or to {@code null}
     * @throws JsonException if the document is not valid JSON or the value is not an array of {@code elementType}
     */
    <T> Optional<List<T>> readListAt(byte[] data, String pointer, Class<T> elementType) throws JsonException;
}
