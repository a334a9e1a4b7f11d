package io.chatstream.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed events of the Responses streaming protocol, one per SSE data frame.
 *
 * <p>The wire {@code type} discriminator selects the variant. Types this library does not
 * model decode to {@link Ignored} so newer servers never break older clients.
 */
public sealed interface StreamEvent permits StreamEvent.Created, StreamEvent.InProgress, StreamEvent.Delta,
        StreamEvent.TextDone, StreamEvent.ContentPartDone, StreamEvent.Completed, StreamEvent.Failed,
        StreamEvent.Incomplete, StreamEvent.Queued, StreamEvent.Error, StreamEvent.Ignored {

    String TYPE_CREATED = "response.created";
    String TYPE_IN_PROGRESS = "response.in_progress";
    String TYPE_COMPLETED = "response.completed";
    String TYPE_FAILED = "response.failed";
    String TYPE_INCOMPLETE = "response.incomplete";
    String TYPE_QUEUED = "response.queued";
    String TYPE_TEXT_DELTA = "response.output_text.delta";
    String TYPE_TEXT_DONE = "response.output_text.done";
    String TYPE_CONTENT_PART_DONE = "response.content_part.done";
    String TYPE_ERROR = "error";

    /**
     * The response object was created.
     *
     * @param responseId server-assigned response id
     * @param status response status as sent by the server (optional)
     */
    record Created(String responseId, Optional<String> status) implements StreamEvent {
        public Created {
            Objects.requireNonNull(responseId, "responseId");
            status = (status == null) ? Optional.empty() : status;
        }
    }

    record InProgress(String responseId) implements StreamEvent {
        public InProgress {
            Objects.requireNonNull(responseId, "responseId");
        }
    }

    /**
     * An incremental text fragment; always appended, never replacing.
     */
    record Delta(String itemId, int outputIndex, int contentIndex, String text) implements StreamEvent {
        public Delta {
            Objects.requireNonNull(itemId, "itemId");
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * The authoritative full text of one output text part.
     */
    record TextDone(String itemId, int contentIndex, String text) implements StreamEvent {
        public TextDone {
            Objects.requireNonNull(itemId, "itemId");
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * A content part finished. Only text parts carry {@code text}.
     */
    record ContentPartDone(String itemId, int contentIndex, Optional<String> text) implements StreamEvent {
        public ContentPartDone {
            Objects.requireNonNull(itemId, "itemId");
            text = (text == null) ? Optional.empty() : text;
        }
    }

    /**
     * The response finished; {@code outputText} is the server's aggregated text when sent.
     */
    record Completed(String responseId, Optional<String> outputText) implements StreamEvent {
        public Completed {
            Objects.requireNonNull(responseId, "responseId");
            outputText = (outputText == null) ? Optional.empty() : outputText;
        }
    }

    record Failed(String responseId, Optional<String> code, String message) implements StreamEvent {
        public Failed {
            Objects.requireNonNull(responseId, "responseId");
            code = (code == null) ? Optional.empty() : code;
            Objects.requireNonNull(message, "message");
        }
    }

    record Incomplete(String responseId) implements StreamEvent {
        public Incomplete {
            Objects.requireNonNull(responseId, "responseId");
        }
    }

    record Queued(String responseId) implements StreamEvent {
        public Queued {
            Objects.requireNonNull(responseId, "responseId");
        }
    }

    /**
     * A stream-level error reported by the server.
     */
    record Error(Optional<String> code, String message, Optional<String> param) implements StreamEvent {
        public Error {
            code = (code == null) ? Optional.empty() : code;
            Objects.requireNonNull(message, "message");
            param = (param == null) ? Optional.empty() : param;
        }
    }

    /**
     * An event type without a model here.
     *
     * @param rawType the wire {@code type} value
     */
    record Ignored(String rawType) implements StreamEvent {
        public Ignored {
            Objects.requireNonNull(rawType, "rawType");
        }
    }
}
