package io.chatstream.core;

import java.util.Objects;
import java.util.Optional;

/**
 * What a {@link ResponseAccumulator} reports to its caller after consuming an event.
 *
 * <p>Every stream ends with exactly one terminal update: {@link Completed}, {@link Failed} or
 * {@link Cancelled}.
 */
public sealed interface StreamUpdate permits StreamUpdate.Started, StreamUpdate.Delta, StreamUpdate.Snapshot,
        StreamUpdate.Completed, StreamUpdate.Failed, StreamUpdate.Cancelled {

    default boolean isTerminal() {
        return false;
    }

    record Started(String responseId) implements StreamUpdate {
        public Started {
            Objects.requireNonNull(responseId, "responseId");
        }
    }

    /**
     * Text appended to the running message.
     */
    record Delta(String text) implements StreamUpdate {
        public Delta {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * The full running text after an authoritative replacement.
     */
    record Snapshot(String text) implements StreamUpdate {
        public Snapshot {
            Objects.requireNonNull(text, "text");
        }
    }

    record Completed(String text, String responseId) implements StreamUpdate {
        public Completed {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(responseId, "responseId");
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * The stream failed; {@code cause} is set for transport and decode failures.
     */
    record Failed(String message, Optional<Throwable> cause) implements StreamUpdate {
        public Failed {
            Objects.requireNonNull(message, "message");
            cause = (cause == null) ? Optional.empty() : cause;
        }

        public Failed(String message) {
            this(message, Optional.empty());
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Cancelled() implements StreamUpdate {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
