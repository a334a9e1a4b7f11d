package io.chatstream.json.jackson;

import io.chatstream.json.spi.JsonCodecs;
import io.chatstream.json.spi.JsonException;
import io.chatstream.json.spi.JsonNode;
import io.chatstream.json.spi.JsonNodeType;
import io.chatstream.json.spi.ObjectNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void readsNestedFields() throws Exception {
        JsonNode root = codec.readTree("{\"type\":\"response.created\",\"response\":{\"id\":\"r1\",\"n\":3}}");

        assertThat(root.getNodeType()).isEqualTo(JsonNodeType.OBJECT);
        assertThat(root.get("type").asText()).isEqualTo("response.created");
        assertThat(root.get("response").get("id").asText()).isEqualTo("r1");
        assertThat(root.get("response").get("n").asInt(-1)).isEqualTo(3);
        assertThat(root.get("missing")).isNull();
    }

    @Test
    void asIntFallsBackForNonNumbers() throws Exception {
        JsonNode root = codec.readTree("{\"a\":\"7\",\"b\":null}");

        assertThat(root.get("a").asInt(-1)).isEqualTo(-1);
        assertThat(root.get("b").isNull()).isTrue();
    }

    @Test
    void rejectsMalformedAndEmptyInput() {
        assertThatThrownBy(() -> codec.readTree("{\"type\":")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree("{} trailing")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree("")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readTree(new byte[0])).isInstanceOf(JsonException.class);
    }

    @Test
    void buildsAndWritesObjectTree() throws Exception {
        ObjectNode root = codec.createObjectNode();
        root.put("model", "gpt-4.1").put("stream", true).put("max_output_tokens", 1000).put("temperature", 0.5);
        ObjectNode item = root.putArray("input").addObject();
        item.put("role", "user").put("content", "hi");

        String json = codec.writeString(root);

        assertThat(json).isEqualTo("{\"model\":\"gpt-4.1\",\"stream\":true,\"max_output_tokens\":1000,"
                + "\"temperature\":0.5,\"input\":[{\"role\":\"user\",\"content\":\"hi\"}]}");
        assertThat(new String(codec.writeBytes(root), StandardCharsets.UTF_8)).isEqualTo(json);
    }

    @Test
    void iteratesArrayElements() throws Exception {
        JsonNode root = codec.readTree("[\"a\",\"b\"]".getBytes(StandardCharsets.UTF_8));

        assertThat(root.isArray()).isTrue();
        assertThat(root.size()).isEqualTo(2);
        assertThat(root.elements().next().asText()).isEqualTo("a");
        assertThat(root.get(1).asText()).isEqualTo("b");
    }

    @Test
    void serviceLoaderFindsJacksonCodec() {
        assertThat(JsonCodecs.load()).isInstanceOf(JacksonJsonCodec.class);
    }
}
