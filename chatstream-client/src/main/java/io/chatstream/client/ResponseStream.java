package io.chatstream.client;

import io.chatstream.core.StreamUpdate;

import java.util.concurrent.Flow;

/**
 * A running response stream.
 *
 * <p>Reading starts when the first subscriber arrives; later subscribers only see updates
 * published after they subscribed. The publisher always ends with exactly one terminal update
 * ({@link StreamUpdate#isTerminal()}) followed by {@code onComplete}.
 */
public interface ResponseStream extends Flow.Publisher<StreamUpdate> {

    /**
     * Stops reading and releases the connection. Publishes a single {@link StreamUpdate.Cancelled}
     * unless the stream has already reached a terminal update, in which case nothing happens and
     * {@link #isCancelled()} stays false. Idempotent.
     */
    void cancel();

    boolean isCancelled();
}
