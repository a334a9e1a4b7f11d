package io.chatstream.json.spi;

import java.util.Iterator;

/**
 * Read-only view of a JSON value (object, array, string, number, boolean, null).
 *
 * <p>Implementations wrap a concrete JSON library so protocol code never imports it.
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Gets an element by index from an array node.
     * Returns null if this is not an array or index is out of bounds.
     */
    JsonNode get(int index);

    /**
     * Returns true if this node has a field with the given name.
     */
    boolean has(String fieldName);

    /**
     * Number of fields (objects) or elements (arrays); 0 otherwise.
     */
    int size();

    /**
     * Returns the text value of this node.
     * For text nodes: the string value
     * For other types: string representation
     */
    String asText();

    /**
     * Returns the int value or the default if not numeric.
     */
    int asInt(int defaultValue);

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();
}
