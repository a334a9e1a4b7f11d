package io.chatstream.core.content;

/**
 * Cheap size and shape metrics of a message text.
 */
public record ContentAnalysis(boolean hasCodeBlocks, int lineCount, int characterCount, Complexity complexity) {

    public enum Complexity {
        LOW,
        MEDIUM,
        HIGH
    }
}
