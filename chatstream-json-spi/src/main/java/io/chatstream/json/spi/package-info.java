/**
 * JSON abstraction used by the protocol modules.
 *
 * <p>Protocol code parses and builds JSON only through {@link io.chatstream.json.spi.JsonCodec};
 * a concrete binding is discovered with {@link java.util.ServiceLoader}.
 */
package io.chatstream.json.spi;
