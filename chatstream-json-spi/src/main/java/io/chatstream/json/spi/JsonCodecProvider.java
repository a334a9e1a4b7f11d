package io.chatstream.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for {@link JsonCodec} implementations.
 */
public interface JsonCodecProvider {

    JsonCodec codec();
}
