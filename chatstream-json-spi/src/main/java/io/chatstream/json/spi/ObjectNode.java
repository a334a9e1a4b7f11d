package io.chatstream.json.spi;

/**
 * Mutable JSON object node builder.
 */
public interface ObjectNode extends JsonNode {

    ObjectNode put(String fieldName, String value);

    ObjectNode put(String fieldName, int value);

    ObjectNode put(String fieldName, double value);

    ObjectNode put(String fieldName, boolean value);

    /**
     * Creates a new object node and sets it as a field.
     */
    ObjectNode putObject(String fieldName);

    /**
     * Creates a new array node and sets it as a field.
     */
    ArrayNode putArray(String fieldName);
}
