package io.chatstream.core.content;

import java.util.List;
import java.util.Objects;

/**
 * Parsed content of one message. Rebuilt from scratch on every text snapshot.
 *
 * <p>Enforces the segment layout: {@link ContentSegment.Attachments} only first,
 * {@link ContentSegment.GeneratedImages} only last, {@link ContentSegment.PartialCode} only
 * while streaming.
 */
public record MessageContent(List<ContentSegment> segments, boolean streaming, String messageId, Role role) {

    public MessageContent {
        segments = List.copyOf(segments);
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(role, "role");
        for (int i = 0; i < segments.size(); i++) {
            ContentSegment s = segments.get(i);
            if (s instanceof ContentSegment.Attachments && i != 0) {
                throw new IllegalArgumentException("attachments segment must be first");
            }
            if (s instanceof ContentSegment.GeneratedImages && i != segments.size() - 1) {
                throw new IllegalArgumentException("generated images segment must be last");
            }
            if (s instanceof ContentSegment.PartialCode && !streaming) {
                throw new IllegalArgumentException("partial code is only valid while streaming");
            }
        }
    }

    /**
     * True if nothing visible would be rendered.
     */
    public boolean isEmpty() {
        for (ContentSegment s : segments) {
            if (s instanceof ContentSegment.Text t && !t.text().isBlank()) return false;
            if (s instanceof ContentSegment.StreamingText t && !t.text().isBlank()) return false;
            if (s instanceof ContentSegment.Code c && !c.code().isBlank()) return false;
            if (s instanceof ContentSegment.PartialCode p && !p.raw().isBlank()) return false;
            if (s instanceof ContentSegment.Attachments a && !a.attachments().isEmpty()) return false;
            if (s instanceof ContentSegment.GeneratedImages g && !g.images().isEmpty()) return false;
        }
        return true;
    }
}
