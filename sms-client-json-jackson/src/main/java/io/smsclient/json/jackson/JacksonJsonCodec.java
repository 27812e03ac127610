package io.smsclient.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.smsclient.json.spi.JsonCodec;
import io.smsclient.json.spi.JsonException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Jackson implementation of JsonCodec.
 * Provides JSON serialization/deserialization using Jackson.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with a mapper configured for the gateway's wire format.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Mapper used by the no-arg constructor: snake_case names, unknown properties ignored, nulls omitted.
     * Is-getters are not auto-detected so record accessors such as {@code isOutgoing()} keep their component name.
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type.getName(), e);
        }
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to " + type.getName(), e);
        }
    }

    @Override
    public <T> Optional<T> readAt(byte[] data, String pointer, Class<T> type) throws JsonException {
        JsonNode node = nodeAt(data, pointer);
        if (node == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.treeToValue(node, type));
        } catch (Exception e) {
            throw JsonException.at(pointer, "Failed to deserialize " + type.getName(), e);
        }
    }

    @Override
    public <T> Optional<List<T>> readListAt(byte[] data, String pointer, Class<T> elementType) throws JsonException {
        JsonNode node = nodeAt(data, pointer);
        if (node == null) {
            return Optional.empty();
        }
        if (!node.isArray()) {
            throw JsonException.at(pointer, "Expected an array but found " + node.getNodeType());
        }
        try {
            JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
            List<T> list = mapper.treeToValue(node, listType);
            return Optional.of(list);
        } catch (Exception e) {
            throw JsonException.at(pointer, "Failed to deserialize List<" + elementType.getName() + ">", e);
        }
    }

    /** Returns the node at {@code pointer}, or null when it is missing or JSON null. */
    private JsonNode nodeAt(byte[] data, String pointer) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot read JSON from empty data");
        }
        JsonNode root;
        try {
            root = mapper.readTree(data);
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON", e);
        }
        if (root == null) {
            throw new JsonException("Invalid JSON: no tokens");
        }
        JsonNode node = root.at(pointer);
        return node.isMissingNode() || node.isNull() ? null : node;
    }
}
