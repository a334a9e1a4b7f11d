package io.chatstream.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Base class for streaming pipeline exceptions.
 *
 * <p>Protocol irregularities (for example a completion without a prior creation event) and
 * parse ambiguities are resolved locally and never raised; only the conditions below abort
 * a stream, and they reach callers as a single failed update carrying the exception.
 */
public abstract class ChatStreamException extends RuntimeException {

    protected ChatStreamException(String message) {
        super(message);
    }

    protected ChatStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the connection fails or the server answers with a non-2xx status.
     *
     * <p>{@link #statusCode()} is {@code 0} when no HTTP response was received.
     */
    public static class Transport extends ChatStreamException {
        private final int statusCode;
        private final String serverMessage;

        public Transport(int statusCode, String serverMessage) {
            super(describe(statusCode, serverMessage));
            this.statusCode = statusCode;
            this.serverMessage = serverMessage;
        }

        public Transport(String message, Throwable cause) {
            super(message, cause);
            this.statusCode = 0;
            this.serverMessage = null;
        }

        public int statusCode() {
            return statusCode;
        }

        public Optional<String> serverMessage() {
            return Optional.ofNullable(serverMessage);
        }

        private static String describe(int statusCode, String serverMessage) {
            String base = "HTTP status " + statusCode;
            return serverMessage == null ? base : base + ": " + serverMessage;
        }
    }

    /**
     * Raised when a stream event lacks a key its type requires.
     */
    public static class MissingField extends ChatStreamException {
        private final String key;
        private final String path;

        public MissingField(String key, String path) {
            super("missing required field '" + key + "' at " + path);
            this.key = Objects.requireNonNull(key, "key");
            this.path = Objects.requireNonNull(path, "path");
        }

        public String key() {
            return key;
        }

        public String path() {
            return path;
        }
    }

    /**
     * Raised when a stream frame is not a JSON object.
     */
    public static class MalformedPayload extends ChatStreamException {
        public MalformedPayload(String message) {
            super(message);
        }

        public MalformedPayload(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
