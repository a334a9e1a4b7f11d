package io.chatstream.client;

import io.chatstream.core.ConversationContext;
import io.chatstream.core.StreamUpdate;
import io.chatstream.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponsesClientBuilderTest {

    private static final ResponsesClientConfig CONFIG = ResponsesClientConfig.builder()
            .baseUrl(URI.create("http://localhost:9/"))
            .apiKey("sk-test")
            .build();

    private static ResponseRequest request() {
        return ResponseRequest.builder("gpt-4.1").input(InputItem.user("hi")).build();
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void builderUsesCustomTransport() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.enqueue(new TransportResponse<>(200, Map.of(), new ByteArrayInputStream(utf8(
                "data: {\"type\":\"response.completed\",\"response\":{\"id\":\"r9\",\"output_text\":\"done\"}}\n\n"))));

        ResponsesClient client = ResponsesClient.builder()
                .transport(transport)
                .config(CONFIG)
                .jsonCodec(new JacksonJsonCodec())
                .build();

        CollectingSubscriber subscriber = new CollectingSubscriber();
        client.stream(request()).subscribe(subscriber);

        assertThat(subscriber.awaitCompletion()).containsExactly(new StreamUpdate.Completed("done", "r9"));
        assertThat(transport.lastRequest.method()).isEqualTo("POST");
        assertThat(transport.lastRequest.url()).isEqualTo(URI.create("http://localhost:9/v1/responses"));
        assertThat(transport.lastRequest.timeout()).isEqualTo(ResponsesClientConfig.DEFAULT_TIMEOUT);
        assertThat(firstHeader(transport.lastRequest.headers(), "Authorization")).isEqualTo("Bearer sk-test");
        assertThat(firstHeader(transport.lastRequest.headers(), "OpenAI-Organization")).isNull();
    }

    @Test
    void nothingIsSentBeforeSubscription() {
        RecordingTransport transport = new RecordingTransport();
        ResponsesClient client = ResponsesClient.builder().transport(transport).config(CONFIG).build();

        ResponseStream stream = client.stream(request());

        assertThat(stream.isCancelled()).isFalse();
        assertThat(transport.lastRequest).isNull();
    }

    @Test
    void cancelMidStreamPublishesOneCancelled() throws Exception {
        PipedOutputStream serverSide = new PipedOutputStream();
        PipedInputStream body = new PipedInputStream(serverSide);
        RecordingTransport transport = new RecordingTransport();
        transport.enqueue(new TransportResponse<>(200, Map.of(), body));
        ConversationContext context = new ConversationContext("r0");

        ResponsesClient client = ResponsesClient.builder().transport(transport).config(CONFIG).build();
        ResponseStream stream = client.stream(request(), context);
        CollectingSubscriber subscriber = new CollectingSubscriber(3);
        stream.subscribe(subscriber);

        serverSide.write(utf8("data: {\"type\":\"response.created\",\"response\":{\"id\":\"r1\"}}\n\n"
                + "data: {\"type\":\"response.output_text.delta\",\"item_id\":\"m\",\"delta\":\"a\"}\n\n"
                + "data: {\"type\":\"response.output_text.delta\",\"item_id\":\"m\",\"delta\":\"b\"}\n\n"));
        serverSide.flush();
        subscriber.awaitReceived();

        stream.cancel();
        stream.cancel();

        List<StreamUpdate> updates = subscriber.awaitCompletion();
        assertThat(updates).containsExactly(
                new StreamUpdate.Started("r1"),
                new StreamUpdate.Delta("a"),
                new StreamUpdate.Delta("b"),
                new StreamUpdate.Cancelled());
        assertThat(stream.isCancelled()).isTrue();
        assertThat(context.previousResponseId()).contains("r0");
    }

    @Test
    void cancelBeforeSubscriptionSendsNothing() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        ResponsesClient client = ResponsesClient.builder().transport(transport).config(CONFIG).build();

        ResponseStream stream = client.stream(request());
        stream.cancel();
        CollectingSubscriber subscriber = new CollectingSubscriber();
        stream.subscribe(subscriber);

        assertThat(subscriber.awaitCompletion()).containsExactly(new StreamUpdate.Cancelled());
        assertThat(transport.lastRequest).isNull();
    }

    @Test
    void cancelAfterCompletionIsNoOp() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.enqueue(new TransportResponse<>(200, Map.of(), new ByteArrayInputStream(utf8(
                "data: {\"type\":\"response.completed\",\"response\":{\"id\":\"r1\",\"output_text\":\"x\"}}\n\n"))));
        ResponsesClient client = ResponsesClient.builder().transport(transport).config(CONFIG).build();

        ResponseStream stream = client.stream(request());
        CollectingSubscriber subscriber = new CollectingSubscriber();
        stream.subscribe(subscriber);
        List<StreamUpdate> updates = subscriber.awaitCompletion();
        stream.cancel();

        assertThat(updates).containsExactly(new StreamUpdate.Completed("x", "r1"));
        assertThat(stream.isCancelled()).isFalse();
    }

    @Test
    void transportExceptionBecomesFailed() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        transport.failWith(new IOException("connection refused"));
        ResponsesClient client = ResponsesClient.builder().transport(transport).config(CONFIG).build();

        CollectingSubscriber subscriber = new CollectingSubscriber();
        client.stream(request()).subscribe(subscriber);

        List<StreamUpdate> updates = subscriber.awaitCompletion();
        assertThat(updates).hasSize(1);
        StreamUpdate.Failed failed = (StreamUpdate.Failed) updates.get(0);
        assertThat(failed.message()).isEqualTo("connection refused");
        assertThat(failed.cause().orElseThrow().getCause()).isInstanceOf(IOException.class);
    }

    private static String firstHeader(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null) return null;
        Iterable<String> values = headers.get(name);
        if (values == null) return null;
        for (String v : values) {
            return v;
        }
        return null;
    }

    private static final class RecordingTransport implements ChatStreamTransport {
        private TransportResponse<InputStream> nextStream;
        private Exception failure;
        private volatile TransportRequest lastRequest;

        void enqueue(TransportResponse<InputStream> response) {
            this.nextStream = response;
        }

        void failWith(Exception failure) {
            this.failure = failure;
        }

        @Override
        public TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception {
            lastRequest = request;
            if (failure != null) {
                throw failure;
            }
            return nextStream;
        }
    }
}
