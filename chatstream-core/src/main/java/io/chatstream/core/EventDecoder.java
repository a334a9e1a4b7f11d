package io.chatstream.core;

import io.chatstream.json.spi.JsonCodec;
import io.chatstream.json.spi.JsonCodecs;
import io.chatstream.json.spi.JsonException;
import io.chatstream.json.spi.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Decodes one SSE data payload into a {@link StreamEvent}.
 *
 * <p>The terminal {@code [DONE]} payload is not JSON; callers check {@link #isDone(String)}
 * first and end the stream instead of decoding it. Instances are stateless and may be shared
 * between threads.
 */
public final class EventDecoder {

    public static final String DONE = "[DONE]";

    private static final String ROOT = "$";

    private final JsonCodec codec;

    public EventDecoder(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Creates a decoder backed by the {@link JsonCodec} registered on the class path.
     */
    public static EventDecoder create() {
        return new EventDecoder(JsonCodecs.load());
    }

    public static boolean isDone(String frame) {
        return frame != null && DONE.equals(frame.trim());
    }

    /**
     * Decodes a data payload with the {@code data:} prefix already removed.
     *
     * @throws ChatStreamException.MalformedPayload if the payload is not a JSON object
     * @throws ChatStreamException.MissingField if a key required by the event type is absent
     * @throws IllegalArgumentException if {@code frame} is the {@code [DONE]} marker
     */
    public StreamEvent decode(String frame) {
        Objects.requireNonNull(frame, "frame");
        if (isDone(frame)) {
            throw new IllegalArgumentException("[DONE] marks end of stream and must not be decoded");
        }

        JsonNode root;
        try {
            root = codec.readTree(frame);
        } catch (JsonException e) {
            throw new ChatStreamException.MalformedPayload("stream frame is not valid JSON", e);
        }
        if (!root.isObject()) {
            throw new ChatStreamException.MalformedPayload("stream frame is not a JSON object: " + root.getNodeType());
        }

        String type = requiredText(root, "type", ROOT);
        switch (type) {
            case StreamEvent.TYPE_CREATED: {
                JsonNode response = requiredObject(root, "response", ROOT);
                return new StreamEvent.Created(responseId(response), optionalText(response, "status"));
            }
            case StreamEvent.TYPE_IN_PROGRESS:
                return new StreamEvent.InProgress(responseId(requiredObject(root, "response", ROOT)));
            case StreamEvent.TYPE_COMPLETED: {
                JsonNode response = requiredObject(root, "response", ROOT);
                return new StreamEvent.Completed(responseId(response), optionalText(response, "output_text"));
            }
            case StreamEvent.TYPE_FAILED:
                return failed(requiredObject(root, "response", ROOT));
            case StreamEvent.TYPE_INCOMPLETE:
                return new StreamEvent.Incomplete(responseId(requiredObject(root, "response", ROOT)));
            case StreamEvent.TYPE_QUEUED:
                return new StreamEvent.Queued(responseId(requiredObject(root, "response", ROOT)));
            case StreamEvent.TYPE_TEXT_DELTA:
                return new StreamEvent.Delta(
                        requiredText(root, "item_id", ROOT),
                        optionalInt(root, "output_index"),
                        optionalInt(root, "content_index"),
                        requiredText(root, "delta", ROOT));
            case StreamEvent.TYPE_TEXT_DONE:
                return new StreamEvent.TextDone(
                        requiredText(root, "item_id", ROOT),
                        optionalInt(root, "content_index"),
                        requiredText(root, "text", ROOT));
            case StreamEvent.TYPE_CONTENT_PART_DONE: {
                JsonNode part = requiredObject(root, "part", ROOT);
                return new StreamEvent.ContentPartDone(
                        requiredText(root, "item_id", ROOT),
                        optionalInt(root, "content_index"),
                        optionalText(part, "text"));
            }
            case StreamEvent.TYPE_ERROR:
                return new StreamEvent.Error(
                        optionalText(root, "code"),
                        requiredText(root, "message", ROOT),
                        optionalText(root, "param"));
            default:
                return new StreamEvent.Ignored(type);
        }
    }

    private static StreamEvent.Failed failed(JsonNode response) {
        JsonNode error = response.get("error");
        Optional<String> code = Optional.empty();
        Optional<String> message = Optional.empty();
        if (error != null && error.isObject()) {
            code = optionalText(error, "code");
            message = optionalText(error, "message");
        }
        return new StreamEvent.Failed(responseId(response), code, message.orElse("Response failed"));
    }

    private static String responseId(JsonNode response) {
        return requiredText(response, "id", ROOT + ".response");
    }

    private static JsonNode requiredObject(JsonNode node, String key, String path) {
        JsonNode child = node.get(key);
        if (child == null || child.isNull()) {
            throw new ChatStreamException.MissingField(key, path);
        }
        if (!child.isObject()) {
            throw new ChatStreamException.MalformedPayload("field '" + key + "' at " + path + " is not an object");
        }
        return child;
    }

    private static String requiredText(JsonNode node, String key, String path) {
        JsonNode child = node.get(key);
        if (child == null || child.isNull()) {
            throw new ChatStreamException.MissingField(key, path);
        }
        if (!child.isTextual()) {
            throw new ChatStreamException.MalformedPayload("field '" + key + "' at " + path + " is not a string");
        }
        return child.asText();
    }

    private static Optional<String> optionalText(JsonNode node, String key) {
        JsonNode child = node.get(key);
        if (child == null || child.isNull()) return Optional.empty();
        return Optional.of(child.asText());
    }

    private static int optionalInt(JsonNode node, String key) {
        JsonNode child = node.get(key);
        return child == null ? 0 : child.asInt(0);
    }
}
