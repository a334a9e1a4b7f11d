package io.chatstream.core.content;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the parsed content of one message in step with its text.
 *
 * <p>Each update re-parses the full text and reports how the rendering must change; the held
 * content is only replaced when something changed. Not thread-safe.
 */
public final class MessageContentTracker {

    private final String messageId;
    private final Role role;
    private final List<AttachmentRef> attachments;
    private ByteBuffer generatedImage;
    private MessageContent content;

    public MessageContentTracker(String messageId, Role role) {
        this(messageId, role, "", List.of(), null);
    }

    public MessageContentTracker(String messageId, Role role, String initialText,
                                 List<AttachmentRef> attachments, ByteBuffer generatedImage) {
        this.messageId = Objects.requireNonNull(messageId, "messageId");
        this.role = Objects.requireNonNull(role, "role");
        this.attachments = List.copyOf(attachments);
        this.generatedImage = generatedImage == null ? null : AttachmentRef.copyOf(generatedImage);
        this.content = build(initialText, false);
    }

    public MessageContent content() {
        return content;
    }

    /**
     * Applies a new streaming snapshot of the text.
     */
    public ContentDiff updateStreaming(String text) {
        return replace(build(text, true));
    }

    /**
     * Applies the final text once the stream completed.
     *
     * @param image image generated for this message, or null to keep the current one
     */
    public ContentDiff finalizeContent(String text, ByteBuffer image) {
        if (image != null) {
            generatedImage = AttachmentRef.copyOf(image);
        }
        return replace(build(text, false));
    }

    private ContentDiff replace(MessageContent next) {
        ContentDiff diff = ContentDiffEngine.diff(content, next);
        if (!diff.isNoChange()) {
            content = next;
        }
        return diff;
    }

    private MessageContent build(String text, boolean streaming) {
        List<ContentSegment> segments = ContentSegmentParser.parse(text, attachments, generatedImage, streaming);
        return new MessageContent(segments, streaming, messageId, role);
    }
}
