package io.chatstream.core;

import io.chatstream.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventDecoderTest {

    private final EventDecoder decoder = new EventDecoder(new JacksonJsonCodec());

    @Test
    void decodesCreated() {
        StreamEvent event = decoder.decode(
                "{\"type\":\"response.created\",\"sequence_number\":0,\"response\":{\"id\":\"resp_1\",\"status\":\"in_progress\"}}");

        assertThat(event).isEqualTo(new StreamEvent.Created("resp_1", Optional.of("in_progress")));
    }

    @Test
    void decodesDeltaWithAddressing() {
        StreamEvent event = decoder.decode("{\"type\":\"response.output_text.delta\",\"item_id\":\"msg_1\","
                + "\"output_index\":1,\"content_index\":2,\"delta\":\"Hel\"}");

        assertThat(event).isEqualTo(new StreamEvent.Delta("msg_1", 1, 2, "Hel"));
    }

    @Test
    void deltaAddressingDefaultsToZero() {
        StreamEvent event = decoder.decode("{\"type\":\"response.output_text.delta\",\"item_id\":\"msg_1\",\"delta\":\"x\"}");

        assertThat(event).isEqualTo(new StreamEvent.Delta("msg_1", 0, 0, "x"));
    }

    @Test
    void decodesTextDoneAndContentPartDone() {
        assertThat(decoder.decode("{\"type\":\"response.output_text.done\",\"item_id\":\"msg_1\",\"output_index\":0,"
                + "\"content_index\":0,\"text\":\"Hello\"}"))
                .isEqualTo(new StreamEvent.TextDone("msg_1", 0, "Hello"));

        assertThat(decoder.decode("{\"type\":\"response.content_part.done\",\"item_id\":\"msg_1\",\"content_index\":0,"
                + "\"part\":{\"type\":\"output_text\",\"text\":\"Hello\",\"annotations\":[]}}"))
                .isEqualTo(new StreamEvent.ContentPartDone("msg_1", 0, Optional.of("Hello")));

        assertThat(decoder.decode("{\"type\":\"response.content_part.done\",\"item_id\":\"msg_1\",\"content_index\":0,"
                + "\"part\":{\"type\":\"refusal\"}}"))
                .isEqualTo(new StreamEvent.ContentPartDone("msg_1", 0, Optional.empty()));
    }

    @Test
    void decodesCompletedWithAndWithoutOutputText() {
        assertThat(decoder.decode("{\"type\":\"response.completed\",\"response\":{\"id\":\"r1\",\"status\":\"completed\","
                + "\"output_text\":\"Hello\"}}"))
                .isEqualTo(new StreamEvent.Completed("r1", Optional.of("Hello")));

        assertThat(decoder.decode("{\"type\":\"response.completed\",\"response\":{\"id\":\"r1\",\"output_text\":null}}"))
                .isEqualTo(new StreamEvent.Completed("r1", Optional.empty()));
    }

    @Test
    void decodesFailedWithServerMessage() {
        StreamEvent event = decoder.decode("{\"type\":\"response.failed\",\"response\":{\"id\":\"r1\",\"status\":\"failed\","
                + "\"error\":{\"code\":\"server_error\",\"message\":\"boom\"}}}");

        assertThat(event).isEqualTo(new StreamEvent.Failed("r1", Optional.of("server_error"), "boom"));
    }

    @Test
    void failedWithoutErrorUsesDefaultMessage() {
        StreamEvent event = decoder.decode("{\"type\":\"response.failed\",\"response\":{\"id\":\"r1\",\"error\":null}}");

        assertThat(event).isEqualTo(new StreamEvent.Failed("r1", Optional.empty(), "Response failed"));
    }

    @Test
    void decodesLifecycleEvents() {
        assertThat(decoder.decode("{\"type\":\"response.in_progress\",\"response\":{\"id\":\"r1\"}}"))
                .isEqualTo(new StreamEvent.InProgress("r1"));
        assertThat(decoder.decode("{\"type\":\"response.incomplete\",\"response\":{\"id\":\"r1\"}}"))
                .isEqualTo(new StreamEvent.Incomplete("r1"));
        assertThat(decoder.decode("{\"type\":\"response.queued\",\"response\":{\"id\":\"r1\"}}"))
                .isEqualTo(new StreamEvent.Queued("r1"));
    }

    @Test
    void decodesErrorEvent() {
        StreamEvent event = decoder.decode("{\"type\":\"error\",\"code\":\"rate_limit_exceeded\",\"message\":\"slow down\",\"param\":null}");

        assertThat(event).isEqualTo(new StreamEvent.Error(Optional.of("rate_limit_exceeded"), "slow down", Optional.empty()));
    }

    @Test
    void unknownTypeDecodesToIgnored() {
        assertThat(decoder.decode("{\"type\":\"response.mcp_call.completed\"}"))
                .isEqualTo(new StreamEvent.Ignored("response.mcp_call.completed"));
        assertThat(decoder.decode("{\"type\":\"response.output_item.added\",\"output_index\":0,\"item\":{}}"))
                .isEqualTo(new StreamEvent.Ignored("response.output_item.added"));
    }

    @Test
    void missingRequiredKeyReportsKeyAndPath() {
        assertThatThrownBy(() -> decoder.decode("{\"type\":\"response.output_text.delta\",\"item_id\":\"m\"}"))
                .isInstanceOfSatisfying(ChatStreamException.MissingField.class, e -> {
                    assertThat(e.key()).isEqualTo("delta");
                    assertThat(e.path()).isEqualTo("$");
                });

        assertThatThrownBy(() -> decoder.decode("{\"type\":\"response.created\",\"response\":{\"status\":\"queued\"}}"))
                .isInstanceOfSatisfying(ChatStreamException.MissingField.class, e -> {
                    assertThat(e.key()).isEqualTo("id");
                    assertThat(e.path()).isEqualTo("$.response");
                });

        assertThatThrownBy(() -> decoder.decode("{\"delta\":\"x\"}"))
                .isInstanceOfSatisfying(ChatStreamException.MissingField.class, e -> assertThat(e.key()).isEqualTo("type"));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> decoder.decode("{\"type\":\"response.output_text.delta\","))
                .isInstanceOf(ChatStreamException.MalformedPayload.class);
        assertThatThrownBy(() -> decoder.decode("[1,2]"))
                .isInstanceOf(ChatStreamException.MalformedPayload.class);
        assertThatThrownBy(() -> decoder.decode("{\"type\":42}"))
                .isInstanceOf(ChatStreamException.MalformedPayload.class);
    }

    @Test
    void doneMarkerIsRecognisedWithoutDecoding() {
        assertThat(EventDecoder.isDone("[DONE]")).isTrue();
        assertThat(EventDecoder.isDone(" [DONE] ")).isTrue();
        assertThat(EventDecoder.isDone("{\"type\":\"[DONE]\"}")).isFalse();
        assertThatThrownBy(() -> decoder.decode("[DONE]")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createResolvesCodecFromClassPath() {
        assertThat(EventDecoder.create().decode("{\"type\":\"x\"}")).isEqualTo(new StreamEvent.Ignored("x"));
    }
}
