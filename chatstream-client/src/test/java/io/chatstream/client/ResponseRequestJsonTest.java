package io.chatstream.client;

import io.chatstream.core.ConversationContext;
import io.chatstream.core.content.AttachmentRef;
import io.chatstream.json.jackson.JacksonJsonCodec;
import io.chatstream.json.spi.JsonCodec;
import io.chatstream.json.spi.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseRequestJsonTest {

    private final JsonCodec codec = new JacksonJsonCodec();

    private JsonNode roundTrip(ResponseRequest request) throws Exception {
        return codec.readTree(ResponseRequestJson.write(codec, request));
    }

    @Test
    void writesDefaultsAndHistory() throws Exception {
        ResponseRequest request = ResponseRequest.builder("gpt-4.1")
                .input(InputItem.user("What is SSE?"))
                .input(InputItem.assistant("Server-sent events."))
                .input(InputItem.user("Thanks"))
                .build();

        JsonNode root = roundTrip(request);

        assertThat(root.get("model").asText()).isEqualTo("gpt-4.1");
        assertThat(root.get("stream").asText()).isEqualTo("true");
        assertThat(root.get("instructions").asText()).isEqualTo(ResponseRequest.DEFAULT_INSTRUCTIONS);
        assertThat(root.get("max_output_tokens").asInt(0)).isEqualTo(1000);
        assertThat(root.get("temperature").asText()).isEqualTo("0.7");
        assertThat(root.has("previous_response_id")).isFalse();
        JsonNode input = root.get("input");
        assertThat(input.size()).isEqualTo(3);
        assertThat(input.get(1).get("role").asText()).isEqualTo("assistant");
        assertThat(input.get(1).get("content").asText()).isEqualTo("Server-sent events.");
    }

    @Test
    void attachmentsBecomeContentParts() throws Exception {
        AttachmentRef png = AttachmentRef.of("dot.png", "image/png", new byte[]{1, 2, 3});
        AttachmentRef pdf = AttachmentRef.of("doc.pdf", "application/pdf", "pdf".getBytes(StandardCharsets.UTF_8));
        ResponseRequest request = ResponseRequest.builder("gpt-4.1")
                .input(InputItem.user("Describe these", List.of(png, pdf)))
                .build();

        JsonNode content = roundTrip(request).get("input").get(0).get("content");

        assertThat(content.isArray()).isTrue();
        assertThat(content.size()).isEqualTo(3);
        assertThat(content.get(0).get("type").asText()).isEqualTo("input_text");
        assertThat(content.get(0).get("text").asText()).isEqualTo("Describe these");
        assertThat(content.get(1).get("type").asText()).isEqualTo("input_image");
        assertThat(content.get(1).get("image_url").asText()).isEqualTo("data:image/png;base64,AQID");
        assertThat(content.get(1).get("detail").asText()).isEqualTo("auto");
        assertThat(content.get(2).get("type").asText()).isEqualTo("input_file");
        assertThat(content.get(2).get("filename").asText()).isEqualTo("doc.pdf");
        assertThat(content.get(2).get("file_data").asText()).isEqualTo("cGRm");
    }

    @Test
    void blankTextWithAttachmentIsOmitted() {
        AttachmentRef png = AttachmentRef.of("dot.png", "image/png", new byte[]{1});

        InputItem item = InputItem.user("  ", List.of(png));

        assertThat(item.content()).hasSize(1);
        assertThat(item.content().get(0)).isInstanceOf(InputContent.Image.class);
    }

    @Test
    void contextSuppliesPreviousResponseId() throws Exception {
        ResponseRequest request = ResponseRequest.builder("gpt-4.1").input(InputItem.user("more")).build();

        assertThat(request.withContext(new ConversationContext())).isSameAs(request);
        JsonNode root = roundTrip(request.withContext(new ConversationContext("resp_42")));

        assertThat(root.get("previous_response_id").asText()).isEqualTo("resp_42");
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> ResponseRequest.builder("gpt-4.1").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResponseRequest.builder("gpt-4.1").input(InputItem.user("x")).maxOutputTokens(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsErrorMessage() throws Exception {
        byte[] body = "{\"error\":{\"message\":\"Rate limit reached\",\"type\":\"requests\",\"param\":null,\"code\":\"rate_limit_exceeded\"}}"
                .getBytes(StandardCharsets.UTF_8);

        assertThat(ResponseRequestJson.errorMessage(codec, body)).contains("Rate limit reached");
        assertThat(ResponseRequestJson.errorMessage(codec, "{}".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(ResponseRequestJson.errorMessage(codec, new byte[0])).isEmpty();
    }
}
