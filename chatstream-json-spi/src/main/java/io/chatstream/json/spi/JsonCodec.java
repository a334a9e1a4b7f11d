package io.chatstream.json.spi;

/**
 * Minimal JSON codec: tree parsing for inbound protocol frames and tree building for
 * outbound request bodies. Implementations wrap specific JSON libraries.
 */
public interface JsonCodec {

    /**
     * Parses a JSON document into a tree.
     * @param json JSON text
     * @return root node, never null
     * @throws JsonException if the text is not valid JSON
     */
    JsonNode readTree(String json) throws JsonException;

    /**
     * Parses a JSON document into a tree.
     * @param data UTF-8 JSON bytes
     * @return root node, never null
     * @throws JsonException if the bytes are not valid JSON
     */
    JsonNode readTree(byte[] data) throws JsonException;

    /**
     * Serializes a node created by this codec to UTF-8 JSON bytes.
     * @throws JsonException if the node was created by another codec or cannot be written
     */
    byte[] writeBytes(JsonNode node) throws JsonException;

    /**
     * Serializes a node created by this codec to a JSON string.
     * @throws JsonException if the node was created by another codec or cannot be written
     */
    String writeString(JsonNode node) throws JsonException;

    ObjectNode createObjectNode();

    ArrayNode createArrayNode();
}
