package io.chatstream.core;

/**
 * Lifecycle of one streamed response.
 */
public enum ResponseStatus {
    IDLE,
    CREATED,
    STREAMING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
