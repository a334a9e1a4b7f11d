package io.chatstream.core.content;

import java.util.Objects;
import java.util.Set;

/**
 * Cheapest re-render strategy between two versions of a message.
 *
 * @param changeType what kind of update is needed
 * @param affectedSegments indices (in the new content) that must be re-rendered
 */
public record ContentDiff(ChangeType changeType, Set<Integer> affectedSegments) {

    public ContentDiff {
        Objects.requireNonNull(changeType, "changeType");
        affectedSegments = Set.copyOf(affectedSegments);
    }

    public sealed interface ChangeType permits NoChange, AppendToLastSegment, SegmentUpdate, FullUpdate {}

    public record NoChange() implements ChangeType {}

    /**
     * Only the last segment grew; it can be extended in place.
     */
    public record AppendToLastSegment(int index) implements ChangeType {}

    /**
     * Exactly one segment changed.
     */
    public record SegmentUpdate(int index) implements ChangeType {}

    public record FullUpdate() implements ChangeType {}

    public boolean isNoChange() {
        return changeType instanceof NoChange;
    }
}
