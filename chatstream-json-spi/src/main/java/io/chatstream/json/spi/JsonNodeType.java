package io.chatstream.json.spi;

/**
 * Enumeration of JSON node types.
 */
public enum JsonNodeType {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL
}
