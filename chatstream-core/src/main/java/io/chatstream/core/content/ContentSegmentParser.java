package io.chatstream.core.content;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits message text into {@link ContentSegment}s at triple-backtick fences.
 *
 * <p>Stateless: callers always pass the full current text, never a delta. Single left-to-right
 * pass over the text.
 *
 * <ul>
 *   <li>Text around fences becomes {@link ContentSegment.Text}; empty regions are omitted.</li>
 *   <li>While streaming, text that contains no fence at all becomes one
 *       {@link ContentSegment.StreamingText}.</li>
 *   <li>A closed fence becomes {@link ContentSegment.Code}. The language is the rest of the
 *       opening line; the newline right before the closing fence is not part of the code.</li>
 *   <li>A fence still open at the end becomes {@link ContentSegment.PartialCode} while streaming,
 *       and plain {@link ContentSegment.Text} (fence included) once the message is final.</li>
 * </ul>
 */
public final class ContentSegmentParser {

    public static final String FENCE = "```";

    private static final int MEDIUM_LINE_THRESHOLD = 50;

    private ContentSegmentParser() {}

    public static List<ContentSegment> parse(String text, boolean streaming) {
        return parse(text, List.of(), null, streaming);
    }

    /**
     * @param text full current message text
     * @param attachments files attached to the message, rendered first
     * @param generatedImage image produced by the model, rendered last; may be null
     * @param streaming whether more text may still arrive
     */
    public static List<ContentSegment> parse(
            String text,
            List<AttachmentRef> attachments,
            ByteBuffer generatedImage,
            boolean streaming
    ) {
        List<ContentSegment> segments = new ArrayList<>();
        if (attachments != null && !attachments.isEmpty()) {
            segments.add(new ContentSegment.Attachments(attachments));
        }
        if (text != null && !text.isEmpty()) {
            parseText(text, streaming, segments);
        }
        if (generatedImage != null) {
            segments.add(new ContentSegment.GeneratedImages(List.of(generatedImage)));
        }
        return segments;
    }

    public static ContentAnalysis analyze(String text) {
        String s = text == null ? "" : text;
        boolean hasCode = s.contains(FENCE);
        int lines = (int) s.chars().filter(c -> c == '\n').count() + 1;
        ContentAnalysis.Complexity complexity = hasCode
                ? ContentAnalysis.Complexity.HIGH
                : lines > MEDIUM_LINE_THRESHOLD ? ContentAnalysis.Complexity.MEDIUM : ContentAnalysis.Complexity.LOW;
        return new ContentAnalysis(hasCode, lines, s.length(), complexity);
    }

    private static void parseText(String text, boolean streaming, List<ContentSegment> out) {
        int open = text.indexOf(FENCE);
        if (open < 0) {
            out.add(streaming ? new ContentSegment.StreamingText(text) : new ContentSegment.Text(text));
            return;
        }

        int cursor = 0;
        while (open >= 0) {
            addText(text.substring(cursor, open), out);

            int langStart = open + FENCE.length();
            int newline = text.indexOf('\n', langStart);
            int inlineClose = text.indexOf(FENCE, langStart);

            if (inlineClose >= 0 && (newline < 0 || inlineClose < newline)) {
                // ```code``` on a single line
                out.add(new ContentSegment.Code(text.substring(langStart, inlineClose), ""));
                cursor = inlineClose + FENCE.length();
            } else if (newline < 0) {
                unterminated(text, open, text.substring(langStart).trim(), streaming, out);
                return;
            } else {
                String language = text.substring(langStart, newline).trim();
                int close = text.indexOf(FENCE, newline + 1);
                if (close < 0) {
                    unterminated(text, open, language, streaming, out);
                    return;
                }
                out.add(new ContentSegment.Code(stripClosingNewline(text.substring(newline + 1, close)), language));
                cursor = close + FENCE.length();
            }
            open = text.indexOf(FENCE, cursor);
        }
        addText(text.substring(cursor), out);
    }

    private static void unterminated(String text, int open, String language, boolean streaming,
                                     List<ContentSegment> out) {
        String raw = text.substring(open);
        if (streaming) {
            out.add(new ContentSegment.PartialCode(raw, language));
            return;
        }
        int last = out.size() - 1;
        if (last >= 0 && out.get(last) instanceof ContentSegment.Text previous) {
            out.set(last, new ContentSegment.Text(previous.text() + raw));
        } else {
            out.add(new ContentSegment.Text(raw));
        }
    }

    private static void addText(String region, List<ContentSegment> out) {
        if (!region.isEmpty()) {
            out.add(new ContentSegment.Text(region));
        }
    }

    private static String stripClosingNewline(String body) {
        if (body.endsWith("\r\n")) return body.substring(0, body.length() - 2);
        if (body.endsWith("\n")) return body.substring(0, body.length() - 1);
        return body;
    }
}
