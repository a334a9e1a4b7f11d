package io.chatstream.client;

import io.chatstream.core.ConversationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of one streamed response.
 */
public record ResponseRequest(
        String model,
        List<InputItem> input,
        String instructions,
        int maxOutputTokens,
        Optional<String> previousResponseId,
        double temperature
) {
    public static final String DEFAULT_INSTRUCTIONS =
            "You are a helpful assistant. Use the conversation history to provide contextual responses.";
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 1000;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public ResponseRequest {
        Objects.requireNonNull(model, "model");
        input = List.copyOf(input);
        if (input.isEmpty()) {
            throw new IllegalArgumentException("input must not be empty");
        }
        Objects.requireNonNull(instructions, "instructions");
        if (maxOutputTokens <= 0) {
            throw new IllegalArgumentException("maxOutputTokens must be positive: " + maxOutputTokens);
        }
        previousResponseId = (previousResponseId == null) ? Optional.empty() : previousResponseId;
    }

    public static Builder builder(String model) {
        return new Builder(model);
    }

    /**
     * Returns a copy chained to the last completed response of {@code context}, if any.
     */
    public ResponseRequest withContext(ConversationContext context) {
        Objects.requireNonNull(context, "context");
        Optional<String> previous = context.previousResponseId();
        if (previous.isEmpty()) {
            return this;
        }
        return new ResponseRequest(model, input, instructions, maxOutputTokens, previous, temperature);
    }

    public static final class Builder {
        private final String model;
        private final List<InputItem> input = new ArrayList<>();
        private String instructions = DEFAULT_INSTRUCTIONS;
        private int maxOutputTokens = DEFAULT_MAX_OUTPUT_TOKENS;
        private String previousResponseId;
        private double temperature = DEFAULT_TEMPERATURE;

        private Builder(String model) {
            this.model = Objects.requireNonNull(model, "model");
        }

        public Builder input(InputItem item) {
            input.add(Objects.requireNonNull(item, "item"));
            return this;
        }

        public Builder input(List<InputItem> items) {
            for (InputItem item : items) {
                input(item);
            }
            return this;
        }

        public Builder instructions(String instructions) {
            this.instructions = Objects.requireNonNull(instructions, "instructions");
            return this;
        }

        public Builder maxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder previousResponseId(String previousResponseId) {
            this.previousResponseId = previousResponseId;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public ResponseRequest build() {
            return new ResponseRequest(model, input, instructions, maxOutputTokens,
                    Optional.ofNullable(previousResponseId), temperature);
        }
    }
}
