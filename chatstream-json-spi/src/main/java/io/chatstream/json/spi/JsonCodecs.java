package io.chatstream.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the {@link JsonCodec} registered on the class path.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Returns the codec of the first {@link JsonCodecProvider} found by {@code cl}.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (it.hasNext()) {
            JsonCodec codec = it.next().codec();
            if (codec != null) return codec;
        }
        throw new IllegalStateException("no JsonCodecProvider registered; add chatstream-json-jackson to the class path");
    }
}
