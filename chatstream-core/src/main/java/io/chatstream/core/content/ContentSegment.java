package io.chatstream.core.content;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * One renderable piece of a message, in document order.
 */
public sealed interface ContentSegment permits ContentSegment.Text, ContentSegment.Code, ContentSegment.StreamingText,
        ContentSegment.PartialCode, ContentSegment.Attachments, ContentSegment.GeneratedImages {

    /**
     * Whether {@code next} can be rendered by extending this segment in place: same variant,
     * the new string starts with the old one and, for code, the language is unchanged.
     */
    default boolean canIncrementallyUpdate(ContentSegment next) {
        return false;
    }

    record Text(String text) implements ContentSegment {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public boolean canIncrementallyUpdate(ContentSegment next) {
            return next instanceof Text t && t.text.startsWith(text);
        }
    }

    /**
     * A fenced code block; {@code code} excludes the fences and the language line.
     */
    record Code(String code, String language) implements ContentSegment {
        public Code {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(language, "language");
        }

        @Override
        public boolean canIncrementallyUpdate(ContentSegment next) {
            return next instanceof Code c && c.language.equals(language) && c.code.startsWith(code);
        }
    }

    /**
     * Text of a message still being streamed that contains no code fence yet.
     */
    record StreamingText(String text) implements ContentSegment {
        public StreamingText {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public boolean canIncrementallyUpdate(ContentSegment next) {
            return next instanceof StreamingText t && t.text.startsWith(text);
        }
    }

    /**
     * An open code block at the end of a streaming message.
     *
     * @param raw text from the opening fence to the end, fence included
     * @param language language token read so far, possibly empty
     */
    record PartialCode(String raw, String language) implements ContentSegment {
        public PartialCode {
            Objects.requireNonNull(raw, "raw");
            Objects.requireNonNull(language, "language");
        }

        @Override
        public boolean canIncrementallyUpdate(ContentSegment next) {
            return next instanceof PartialCode p && p.language.equals(language) && p.raw.startsWith(raw);
        }
    }

    record Attachments(List<AttachmentRef> attachments) implements ContentSegment {
        public Attachments {
            attachments = List.copyOf(attachments);
        }
    }

    /**
     * Images produced by the model. The bytes are copied on construction and
     * {@link #images()} hands out independent read-only views.
     */
    record GeneratedImages(List<ByteBuffer> images) implements ContentSegment {
        public GeneratedImages {
            images = images.stream().map(AttachmentRef::copyOf).toList();
        }

        @Override
        public List<ByteBuffer> images() {
            return images.stream().map(ByteBuffer::duplicate).toList();
        }
    }
}
