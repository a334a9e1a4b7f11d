package io.chatstream.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatstream.json.spi.ArrayNode;
import io.chatstream.json.spi.JsonCodec;
import io.chatstream.json.spi.JsonException;
import io.chatstream.json.spi.JsonNode;
import io.chatstream.json.spi.ObjectNode;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with a default ObjectMapper that rejects trailing tokens.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory()).enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        if (json == null || json.isBlank()) {
            throw new JsonException("Cannot parse empty JSON text");
        }
        try {
            return JacksonJsonNode.wrap(mapper.readTree(json), mapper);
        } catch (Exception e) {
            throw new JsonException("Failed to parse string to tree", e);
        }
    }

    @Override
    public JsonNode readTree(byte[] data) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot parse empty JSON data");
        }
        try {
            return JacksonJsonNode.wrap(mapper.readTree(data), mapper);
        } catch (Exception e) {
            throw new JsonException("Failed to parse bytes to tree", e);
        }
    }

    @Override
    public byte[] writeBytes(JsonNode node) throws JsonException {
        try {
            return mapper.writeValueAsBytes(JacksonJsonNode.unwrap(node));
        } catch (IllegalArgumentException e) {
            throw new JsonException("Node was not created by this codec", e);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize node to bytes", e);
        }
    }

    @Override
    public String writeString(JsonNode node) throws JsonException {
        try {
            return mapper.writeValueAsString(JacksonJsonNode.unwrap(node));
        } catch (IllegalArgumentException e) {
            throw new JsonException("Node was not created by this codec", e);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize node to string", e);
        }
    }

    @Override
    public ObjectNode createObjectNode() {
        return new JacksonObjectNode(mapper.createObjectNode(), mapper);
    }

    @Override
    public ArrayNode createArrayNode() {
        return new JacksonArrayNode(mapper.createArrayNode(), mapper);
    }
}
