package io.chatstream.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Assembles decoded {@link StreamEvent}s into the running message of one response.
 *
 * <p>State machine: {@code IDLE -> CREATED -> STREAMING -> COMPLETED | FAILED | CANCELLED}.
 * Deltas append to the running text; {@code output_text.done} and {@code content_part.done}
 * replace it with the server's authoritative text. Once a terminal status is reached every
 * further event is discarded, so each stream yields exactly one terminal update.
 *
 * <p>If a completion arrives without authoritative text and without {@code output_text},
 * the text built from deltas is used as the final text. This is best effort only.
 *
 * <p>Not thread-safe: one instance per stream, driven by the thread that reads the stream.
 */
public final class ResponseAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ResponseAccumulator.class);

    private final ConversationContext context;

    private ResponseStatus status = ResponseStatus.IDLE;
    private String responseId;
    private final StringBuilder text = new StringBuilder();

    public ResponseAccumulator() {
        this(new ConversationContext());
    }

    public ResponseAccumulator(ConversationContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Applies one event.
     *
     * @return the update to publish, or empty if the event changes nothing visible
     */
    public Optional<StreamUpdate> accept(StreamEvent event) {
        Objects.requireNonNull(event, "event");
        if (status.isTerminal()) {
            if (log.isDebugEnabled()) {
                log.debug("discarding {} after terminal status {}", event.getClass().getSimpleName(), status);
            }
            return Optional.empty();
        }

        if (event instanceof StreamEvent.Created created) {
            return onCreated(created);
        }
        if (event instanceof StreamEvent.Delta delta) {
            status = ResponseStatus.STREAMING;
            text.append(delta.text());
            return Optional.of(new StreamUpdate.Delta(delta.text()));
        }
        if (event instanceof StreamEvent.TextDone done) {
            return replaceText(done.text());
        }
        if (event instanceof StreamEvent.ContentPartDone partDone) {
            return partDone.text().flatMap(this::replaceText);
        }
        if (event instanceof StreamEvent.Completed completed) {
            return onCompleted(completed);
        }
        if (event instanceof StreamEvent.Failed failed) {
            return terminate(ResponseStatus.FAILED, new StreamUpdate.Failed(failed.message()));
        }
        if (event instanceof StreamEvent.Error error) {
            return terminate(ResponseStatus.FAILED, new StreamUpdate.Failed(error.message()));
        }
        if (event instanceof StreamEvent.Incomplete incomplete) {
            log.info("response {} reported incomplete", incomplete.responseId());
            return Optional.empty();
        }
        if (event instanceof StreamEvent.Ignored ignored) {
            if (log.isDebugEnabled()) {
                log.debug("ignoring event type {}", ignored.rawType());
            }
            return Optional.empty();
        }
        // InProgress, Queued
        return Optional.empty();
    }

    /**
     * Cancels the stream from any non-terminal state.
     *
     * @return the single {@link StreamUpdate.Cancelled}, or empty if already terminal
     */
    public Optional<StreamUpdate> cancel() {
        if (status.isTerminal()) return Optional.empty();
        text.setLength(0);
        return terminate(ResponseStatus.CANCELLED, new StreamUpdate.Cancelled());
    }

    /**
     * Aborts the stream because of a transport or decode failure.
     *
     * @return the single {@link StreamUpdate.Failed} carrying {@code cause}, or empty if already terminal
     */
    public Optional<StreamUpdate> fail(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        if (status.isTerminal()) return Optional.empty();
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return terminate(ResponseStatus.FAILED, new StreamUpdate.Failed(message, Optional.of(cause)));
    }

    public ResponseState state() {
        return new ResponseState(
                Optional.ofNullable(responseId),
                text.toString(),
                status,
                context.previousResponseId());
    }

    public ResponseStatus status() {
        return status;
    }

    public ConversationContext context() {
        return context;
    }

    private Optional<StreamUpdate> onCreated(StreamEvent.Created created) {
        if (status != ResponseStatus.IDLE) {
            log.debug("duplicate response.created for {}", created.responseId());
            return Optional.empty();
        }
        status = ResponseStatus.CREATED;
        responseId = created.responseId();
        return Optional.of(new StreamUpdate.Started(responseId));
    }

    private Optional<StreamUpdate> replaceText(String authoritative) {
        status = ResponseStatus.STREAMING;
        if (log.isDebugEnabled() && !authoritative.contentEquals(text)) {
            log.debug("authoritative text differs from accumulated deltas ({} vs {} chars)",
                    authoritative.length(), text.length());
        }
        text.setLength(0);
        text.append(authoritative);
        return Optional.of(new StreamUpdate.Snapshot(authoritative));
    }

    private Optional<StreamUpdate> onCompleted(StreamEvent.Completed completed) {
        if (responseId == null) {
            log.debug("response.completed without response.created; using id {}", completed.responseId());
        }
        responseId = completed.responseId();
        context.recordCompleted(completed.responseId());
        String finalText = completed.outputText().orElseGet(text::toString);
        text.setLength(0);
        text.append(finalText);
        return terminate(ResponseStatus.COMPLETED, new StreamUpdate.Completed(finalText, completed.responseId()));
    }

    private Optional<StreamUpdate> terminate(ResponseStatus terminal, StreamUpdate update) {
        status = terminal;
        return Optional.of(update);
    }
}
