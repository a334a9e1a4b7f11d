package io.chatstream.core.content;

import java.util.Locale;

/**
 * Author of a message.
 */
public enum Role {
    USER,
    ASSISTANT,
    SYSTEM;

    /**
     * Wire name, e.g. {@code "assistant"}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
