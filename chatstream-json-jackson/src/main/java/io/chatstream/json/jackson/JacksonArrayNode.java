package io.chatstream.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatstream.json.spi.ArrayNode;
import io.chatstream.json.spi.ObjectNode;

/**
 * Jackson implementation of ArrayNode.
 */
final class JacksonArrayNode extends JacksonJsonNode implements ArrayNode {
    private final com.fasterxml.jackson.databind.node.ArrayNode arrayDelegate;

    JacksonArrayNode(com.fasterxml.jackson.databind.node.ArrayNode delegate, ObjectMapper mapper) {
        super(delegate, mapper);
        this.arrayDelegate = delegate;
    }

    @Override
    public ArrayNode add(String value) {
        arrayDelegate.add(value);
        return this;
    }

    @Override
    public ObjectNode addObject() {
        return new JacksonObjectNode(arrayDelegate.addObject(), mapper);
    }
}
