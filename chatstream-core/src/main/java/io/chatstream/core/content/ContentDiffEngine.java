package io.chatstream.core.content;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Classifies the cheapest update between two {@link MessageContent}s.
 *
 * <p>Checks run in order and the first match wins: no change, append to the last segment,
 * update of a single segment, full update. Append is checked before single-segment update
 * because extending a segment is cheaper than replacing it. Every result is equivalent to
 * re-rendering the new content from scratch.
 */
public final class ContentDiffEngine {
    private ContentDiffEngine() {}

    public static ContentDiff diff(MessageContent previous, MessageContent next) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(next, "next");

        if (previous.equals(next)) {
            return new ContentDiff(new ContentDiff.NoChange(), Set.of());
        }

        List<ContentSegment> before = previous.segments();
        List<ContentSegment> after = next.segments();

        if (before.size() == after.size()) {
            int last = before.size() - 1;
            if (last >= 0
                    && before.subList(0, last).equals(after.subList(0, last))
                    && before.get(last).canIncrementallyUpdate(after.get(last))) {
                return new ContentDiff(new ContentDiff.AppendToLastSegment(last), Set.of(last));
            }

            Set<Integer> changed = new HashSet<>();
            for (int i = 0; i < before.size(); i++) {
                if (!before.get(i).equals(after.get(i))) {
                    changed.add(i);
                }
            }
            if (changed.size() == 1) {
                int index = changed.iterator().next();
                return new ContentDiff(new ContentDiff.SegmentUpdate(index), changed);
            }
        }

        Set<Integer> all = IntStream.range(0, after.size()).boxed().collect(Collectors.toSet());
        return new ContentDiff(new ContentDiff.FullUpdate(), all);
    }
}
