package io.chatstream.client;

import io.chatstream.json.spi.JsonCodec;
import io.chatstream.json.spi.JsonCodecs;

import java.net.http.HttpClient;
import java.util.Objects;

public final class ResponsesClientBuilder {
    private ChatStreamTransport transport;
    private ResponsesClientConfig config;
    private JsonCodec codec;

    public ResponsesClientBuilder transport(ChatStreamTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public ResponsesClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public ResponsesClientBuilder config(ResponsesClientConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public ResponsesClientBuilder jsonCodec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    /**
     * Builds the client. Without an explicit config the environment is read; without a codec
     * the one registered on the class path is used.
     */
    public ResponsesClient build() {
        ResponsesClientConfig resolvedConfig = config == null ? ResponsesClientConfig.fromEnvironment() : config;
        JsonCodec resolvedCodec = codec == null ? JsonCodecs.load() : codec;
        ChatStreamTransport resolved = transport;
        if (resolved == null) {
            resolved = new JdkHttpTransport(HttpClient.newBuilder()
                    .connectTimeout(resolvedConfig.timeout())
                    .build());
        }
        return new JdkResponsesClient(resolved, resolvedCodec, resolvedConfig);
    }
}
