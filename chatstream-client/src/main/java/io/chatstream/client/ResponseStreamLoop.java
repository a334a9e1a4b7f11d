package io.chatstream.client;

import io.chatstream.core.ChatStreamException;
import io.chatstream.core.ConversationContext;
import io.chatstream.core.EventDecoder;
import io.chatstream.core.ResponseAccumulator;
import io.chatstream.core.SseParser;
import io.chatstream.core.StreamUpdate;
import io.chatstream.json.spi.JsonCodec;
import io.chatstream.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Internal implementation of the response read loop.
 *
 * <p>The loop thread owns the {@link ResponseAccumulator}; {@link #cancel()} only flags the
 * stream, closes the body and interrupts the thread, which then publishes the cancellation.
 */
final class ResponseStreamLoop implements ResponseStream {

    private static final Logger log = LoggerFactory.getLogger(ResponseStreamLoop.class);

    static final String ENDED_EARLY = "stream ended before completion";

    private final ChatStreamTransport transport;
    private final JsonCodec codec;
    private final EventDecoder decoder;
    private final ResponsesClientConfig config;
    private final ResponseRequest request;
    private final ConversationContext context;

    private final SubmissionPublisher<StreamUpdate> pub = new SubmissionPublisher<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile InputStream body;
    private volatile Thread worker;

    ResponseStreamLoop(ChatStreamTransport transport, JsonCodec codec, ResponsesClientConfig config,
                       ResponseRequest request, ConversationContext context) {
        this.transport = transport;
        this.codec = codec;
        this.decoder = new EventDecoder(codec);
        this.config = config;
        this.request = request;
        this.context = context;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super StreamUpdate> subscriber) {
        pub.subscribe(subscriber);
        if (started.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, "chatstream-response");
            t.setDaemon(true);
            worker = t;
            t.start();
        }
    }

    @Override
    public void cancel() {
        if (finished.get() || !cancelled.compareAndSet(false, true)) {
            return;
        }
        log.debug("cancelling response stream");
        closeBody();
        Thread t = worker;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    private void run() {
        ResponseAccumulator accumulator = new ResponseAccumulator(context);
        try {
            if (!cancelled.get()) {
                read(accumulator);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!cancelled.get()) {
                publish(accumulator.fail(new ChatStreamException.Transport("interrupted", e)));
            }
        } catch (ChatStreamException e) {
            if (!cancelled.get()) {
                log.warn("response stream aborted: {}", e.getMessage());
                publish(accumulator.fail(e));
            }
        } catch (Exception e) {
            if (!cancelled.get()) {
                log.warn("response stream aborted", e);
                publish(accumulator.fail(new ChatStreamException.Transport(describe(e), e)));
            }
        } finally {
            closeBody();
            if (cancelled.get()) {
                publish(accumulator.cancel());
            } else if (!accumulator.status().isTerminal()) {
                publish(accumulator.fail(new ChatStreamException.Transport(ENDED_EARLY, null)));
            }
            pub.close();
        }
    }

    private void read(ResponseAccumulator accumulator) throws Exception {
        byte[] payload = ResponseRequestJson.write(codec, request);
        TransportRequest req = new TransportRequest("POST", config.responsesUrl(), headers(), payload, config.timeout());
        if (log.isDebugEnabled()) {
            log.debug("POST {} model={} items={}", req.url(), request.model(), request.input().size());
        }

        TransportResponse<InputStream> resp = transport.sendStream(req);
        body = resp.body();
        if (cancelled.get()) {
            return;
        }
        if (!resp.isSuccessful()) {
            throw errorFor(resp);
        }
        if (resp.body() == null) {
            throw new ChatStreamException.Transport(ENDED_EARLY, null);
        }

        try (SseParser parser = new SseParser(resp.body())) {
            SseParser.Event ev;
            while (!cancelled.get() && (ev = parser.next()) != null) {
                if (ev.isDone()) {
                    log.debug("received [DONE]");
                    return;
                }
                publish(accumulator.accept(decoder.decode(ev.data())));
                if (accumulator.status().isTerminal()) {
                    return;
                }
            }
        } catch (IOException e) {
            if (cancelled.get()) {
                return;
            }
            throw e;
        }
    }

    private Map<String, Iterable<String>> headers() {
        Map<String, Iterable<String>> headers = new LinkedHashMap<>();
        headers.put("Content-Type", List.of("application/json"));
        headers.put("Accept", List.of("text/event-stream"));
        headers.put("Authorization", List.of("Bearer " + config.apiKey()));
        config.organizationId().ifPresent(org -> headers.put("OpenAI-Organization", List.of(org)));
        for (Map.Entry<String, String> e : config.extraHeaders().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }

    private ChatStreamException.Transport errorFor(TransportResponse<InputStream> resp) {
        String serverMessage = null;
        if (resp.body() != null) {
            try (InputStream in = resp.body()) {
                serverMessage = ResponseRequestJson.errorMessage(codec, in.readAllBytes()).orElse(null);
            } catch (IOException | JsonException e) {
                log.debug("unreadable error body for status {}", resp.status(), e);
            }
        }
        return new ChatStreamException.Transport(resp.status(), serverMessage);
    }

    private void publish(Optional<StreamUpdate> update) {
        update.ifPresent(u -> {
            if (u.isTerminal()) {
                finished.set(true);
            }
            pub.submit(u);
        });
    }

    private void closeBody() {
        InputStream in = body;
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            log.debug("failed to close response body", e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
