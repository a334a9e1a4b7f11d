package io.chatstream.core.content;

import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

/**
 * A file attached to a message.
 *
 * @param filename display name
 * @param mimeType MIME type, e.g. {@code image/png}
 * @param data file bytes, copied on construction; equality compares content
 */
public record AttachmentRef(String filename, String mimeType, ByteBuffer data) {
    public AttachmentRef {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(data, "data");
        data = copyOf(data);
    }

    /**
     * Returns an independent read-only view; reading it does not affect this attachment.
     */
    @Override
    public ByteBuffer data() {
        return data.duplicate();
    }

    public static AttachmentRef of(String filename, String mimeType, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new AttachmentRef(filename, mimeType, ByteBuffer.wrap(bytes));
    }

    public boolean isImage() {
        return mimeType.toLowerCase(Locale.ROOT).startsWith("image/");
    }

    public int size() {
        return data.remaining();
    }

    public String base64Data() {
        return Base64.getEncoder().encodeToString(bytes());
    }

    public byte[] bytes() {
        byte[] out = new byte[data.remaining()];
        data.duplicate().get(out);
        return out;
    }

    static ByteBuffer copyOf(ByteBuffer source) {
        byte[] out = new byte[source.remaining()];
        source.duplicate().get(out);
        return ByteBuffer.wrap(out).asReadOnlyBuffer();
    }
}
