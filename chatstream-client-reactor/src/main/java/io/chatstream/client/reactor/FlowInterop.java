package io.chatstream.client.reactor;

import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * Interop utilities for Java {@link Flow} and Reactive Streams.
 */
public final class FlowInterop {
    private FlowInterop() {}

    public static <T> org.reactivestreams.Publisher<T> toReactiveStreams(Flow.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return org.reactivestreams.FlowAdapters.toPublisher(publisher);
    }
}
