package io.chatstream.client;

import io.chatstream.core.ConversationContext;

/**
 * Streaming client for the Responses API.
 */
public interface ResponsesClient {

    /**
     * Starts streaming {@code request}, chained to the last completed response of
     * {@code context}. The context is updated when the response completes.
     */
    ResponseStream stream(ResponseRequest request, ConversationContext context);

    /**
     * Streams a single request outside of any conversation.
     */
    default ResponseStream stream(ResponseRequest request) {
        return stream(request, new ConversationContext());
    }

    static ResponsesClient create(ResponsesClientConfig config) {
        return builder().config(config).build();
    }

    static ResponsesClientBuilder builder() {
        return new ResponsesClientBuilder();
    }
}
