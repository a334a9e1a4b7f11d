package io.chatstream.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of a {@link ResponseAccumulator}'s state.
 *
 * @param responseId id from the creation (or completion) event, if seen
 * @param accumulatedText running text
 * @param status current lifecycle status
 * @param previousResponseId id to continue the conversation from on the next turn
 */
public record ResponseState(
        Optional<String> responseId,
        String accumulatedText,
        ResponseStatus status,
        Optional<String> previousResponseId
) {
    public ResponseState {
        responseId = (responseId == null) ? Optional.empty() : responseId;
        Objects.requireNonNull(accumulatedText, "accumulatedText");
        Objects.requireNonNull(status, "status");
        previousResponseId = (previousResponseId == null) ? Optional.empty() : previousResponseId;
    }
}
