package io.chatstream.json.spi;

/**
 * Mutable JSON array node builder.
 */
public interface ArrayNode extends JsonNode {

    ArrayNode add(String value);

    /**
     * Creates a new object node and adds it to this array.
     */
    ObjectNode addObject();
}
