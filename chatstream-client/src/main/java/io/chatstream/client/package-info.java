/**
 * Streaming client for the Responses API over {@link java.net.http.HttpClient}.
 *
 * <p>{@link io.chatstream.client.ResponsesClient#stream} posts a request and publishes the
 * {@link io.chatstream.core.StreamUpdate}s produced by the core pipeline as a
 * {@link java.util.concurrent.Flow.Publisher}.
 */
package io.chatstream.client;
