package io.chatstream.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatstream.json.spi.JsonNode;
import io.chatstream.json.spi.JsonNodeType;

import java.util.Iterator;
import java.util.Objects;

/**
 * Jackson implementation of JsonNode.
 * Wraps a Jackson JsonNode and delegates all operations to it.
 */
class JacksonJsonNode implements JsonNode {
    final com.fasterxml.jackson.databind.JsonNode delegate;
    final ObjectMapper mapper;

    JacksonJsonNode(com.fasterxml.jackson.databind.JsonNode delegate, ObjectMapper mapper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public JsonNodeType getNodeType() {
        if (delegate.isObject()) return JsonNodeType.OBJECT;
        if (delegate.isArray()) return JsonNodeType.ARRAY;
        if (delegate.isTextual()) return JsonNodeType.STRING;
        if (delegate.isNumber()) return JsonNodeType.NUMBER;
        if (delegate.isBoolean()) return JsonNodeType.BOOLEAN;
        return JsonNodeType.NULL;
    }

    @Override
    public JsonNode get(String fieldName) {
        return wrap(delegate.get(fieldName), mapper);
    }

    @Override
    public JsonNode get(int index) {
        return wrap(delegate.get(index), mapper);
    }

    @Override
    public boolean has(String fieldName) {
        return delegate.has(fieldName);
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public String asText() {
        return delegate.asText();
    }

    @Override
    public int asInt(int defaultValue) {
        return delegate.isNumber() ? delegate.asInt() : defaultValue;
    }

    @Override
    public Iterator<JsonNode> elements() {
        Iterator<com.fasterxml.jackson.databind.JsonNode> iter = delegate.elements();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iter.hasNext();
            }

            @Override
            public JsonNode next() {
                return wrap(iter.next(), mapper);
            }
        };
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JacksonJsonNode other)) return false;
        return delegate.equals(other.delegate);
    }

    @Override
    public int hashCode() {
        return delegate.hashCode();
    }

    static JsonNode wrap(com.fasterxml.jackson.databind.JsonNode node, ObjectMapper mapper) {
        if (node == null) return null;
        if (node instanceof com.fasterxml.jackson.databind.node.ObjectNode on) {
            return new JacksonObjectNode(on, mapper);
        }
        if (node instanceof com.fasterxml.jackson.databind.node.ArrayNode an) {
            return new JacksonArrayNode(an, mapper);
        }
        return new JacksonJsonNode(node, mapper);
    }

    static com.fasterxml.jackson.databind.JsonNode unwrap(JsonNode node) {
        if (node instanceof JacksonJsonNode jjn) {
            return jjn.delegate;
        }
        throw new IllegalArgumentException("Cannot unwrap non-Jackson JsonNode");
    }
}
