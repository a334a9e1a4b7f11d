package io.chatstream.client;

import io.chatstream.json.spi.ArrayNode;
import io.chatstream.json.spi.JsonCodec;
import io.chatstream.json.spi.JsonException;
import io.chatstream.json.spi.JsonNode;
import io.chatstream.json.spi.ObjectNode;

import java.util.Optional;

/**
 * Wire form of {@link ResponseRequest} and of the API error body.
 */
final class ResponseRequestJson {

    private ResponseRequestJson() {
    }

    static byte[] write(JsonCodec codec, ResponseRequest request) throws JsonException {
        return codec.writeBytes(toTree(codec, request));
    }

    static ObjectNode toTree(JsonCodec codec, ResponseRequest request) {
        ObjectNode root = codec.createObjectNode();
        root.put("model", request.model());
        root.put("stream", true);
        root.put("instructions", request.instructions());
        root.put("max_output_tokens", request.maxOutputTokens());
        root.put("temperature", request.temperature());
        request.previousResponseId().ifPresent(id -> root.put("previous_response_id", id));

        ArrayNode input = root.putArray("input");
        for (InputItem item : request.input()) {
            ObjectNode message = input.addObject();
            message.put("role", item.role().wireName());
            if (item.isPlainText()) {
                message.put("content", ((InputContent.Text) item.content().get(0)).text());
                continue;
            }
            ArrayNode parts = message.putArray("content");
            for (InputContent part : item.content()) {
                writePart(parts.addObject(), part);
            }
        }
        return root;
    }

    private static void writePart(ObjectNode node, InputContent part) {
        if (part instanceof InputContent.Text text) {
            node.put("type", "input_text");
            node.put("text", text.text());
        } else if (part instanceof InputContent.Image image) {
            node.put("type", "input_image");
            node.put("image_url", image.imageUrl());
            node.put("detail", image.detail());
        } else if (part instanceof InputContent.File file) {
            node.put("type", "input_file");
            node.put("filename", file.filename());
            node.put("file_data", file.base64Data());
        }
    }

    /**
     * Extracts {@code error.message} from an API error body.
     */
    static Optional<String> errorMessage(JsonCodec codec, byte[] body) throws JsonException {
        if (body == null || body.length == 0) {
            return Optional.empty();
        }
        JsonNode root = codec.readTree(body);
        JsonNode error = root.get("error");
        if (error == null || !error.isObject()) {
            return Optional.empty();
        }
        JsonNode message = error.get("message");
        if (message == null || !message.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(message.asText());
    }
}
