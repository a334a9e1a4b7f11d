package io.chatstream.core;

import java.util.Optional;

/**
 * Per-conversation continuity state.
 *
 * <p>Holds the id of the last completed response so the next request can reference it as
 * {@code previous_response_id}. Each conversation owns its own context; contexts are never
 * shared between conversations.
 */
public final class ConversationContext {

    private volatile String previousResponseId;

    public ConversationContext() {
    }

    public ConversationContext(String previousResponseId) {
        this.previousResponseId = previousResponseId;
    }

    public Optional<String> previousResponseId() {
        return Optional.ofNullable(previousResponseId);
    }

    void recordCompleted(String responseId) {
        this.previousResponseId = responseId;
    }

    /**
     * Starts the conversation over; the next request carries no previous response id.
     */
    public void reset() {
        this.previousResponseId = null;
    }

    @Override
    public String toString() {
        return "ConversationContext{previousResponseId=" + previousResponseId + "}";
    }
}
