/**
 * Protocol core of the Responses streaming pipeline.
 *
 * <p>This module is framework-neutral. It contains only:
 * <ul>
 *   <li>An SSE frame reader and the decoder from frames to {@link io.chatstream.core.StreamEvent}</li>
 *   <li>The {@link io.chatstream.core.ResponseAccumulator} state machine producing
 *       {@link io.chatstream.core.StreamUpdate}s</li>
 *   <li>The content parser and diff engine in {@code io.chatstream.core.content}</li>
 * </ul>
 *
 * <p>JSON is read through the {@code chatstream-json-spi} abstraction; HTTP lives in other modules.
 */
package io.chatstream.core;
