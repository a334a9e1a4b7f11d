package io.chatstream.client.reactor;

import io.chatstream.client.ResponseRequest;
import io.chatstream.client.ResponseStream;
import io.chatstream.client.ResponsesClient;
import io.chatstream.core.ConversationContext;
import io.chatstream.core.StreamUpdate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Reactor adapter over {@link ResponsesClient}.
 *
 * <p>Each subscription starts its own request. Cancelling the subscription cancels the
 * underlying {@link ResponseStream}.
 */
public final class ReactorResponsesClient {

    private final ResponsesClient delegate;

    public ReactorResponsesClient(ResponsesClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public ResponsesClient delegate() {
        return delegate;
    }

    public Flux<StreamUpdate> stream(ResponseRequest request, ConversationContext context) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(context, "context");
        return Flux.defer(() -> {
            ResponseStream stream = delegate.stream(request, context);
            return Flux.from(FlowInterop.toReactiveStreams(stream)).doOnCancel(stream::cancel);
        });
    }

    public Flux<StreamUpdate> stream(ResponseRequest request) {
        return stream(request, new ConversationContext());
    }

    /**
     * Emits only the terminal update of the stream.
     */
    public Mono<StreamUpdate> terminal(ResponseRequest request, ConversationContext context) {
        return stream(request, context).filter(StreamUpdate::isTerminal).last();
    }
}
