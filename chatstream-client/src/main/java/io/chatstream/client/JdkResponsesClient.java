package io.chatstream.client;

import io.chatstream.core.ConversationContext;
import io.chatstream.json.spi.JsonCodec;

import java.util.Objects;

public final class JdkResponsesClient implements ResponsesClient {

    private final ChatStreamTransport transport;
    private final JsonCodec codec;
    private final ResponsesClientConfig config;

    public JdkResponsesClient(ChatStreamTransport transport, JsonCodec codec, ResponsesClientConfig config) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.config = Objects.requireNonNull(config, "config");
    }

    public ResponsesClientConfig config() {
        return config;
    }

    @Override
    public ResponseStream stream(ResponseRequest request, ConversationContext context) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(context, "context");
        return new ResponseStreamLoop(transport, codec, config, request.withContext(context), context);
    }
}
