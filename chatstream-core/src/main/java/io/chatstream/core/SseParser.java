package io.chatstream.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Minimal SSE frame reader for the Responses event stream.
 *
 * <p>Multiple {@code data:} lines of one frame are joined with {@code \n}; comment lines
 * (leading {@code :}) are skipped. Frames without data, such as keep-alives, are skipped.
 */
public final class SseParser implements AutoCloseable {

    public record Event(String eventType, String data) {
        public boolean isDone() {
            return EventDecoder.isDone(data);
        }
    }

    private final BufferedReader in;

    public SseParser(InputStream is) {
        this.in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /** @return next event, or {@code null} if EOF */
    public Event next() throws IOException {
        while (true) {
            String eventType = "message";
            StringBuilder data = null;
            boolean seenAny = false;

            String line;
            while ((line = in.readLine()) != null) {
                seenAny = true;
                if (line.isEmpty()) break;
                if (line.startsWith(":")) continue;
                if (line.startsWith("event:")) {
                    eventType = line.substring("event:".length()).trim();
                } else if (line.startsWith("data:")) {
                    if (data == null) {
                        data = new StringBuilder();
                    } else {
                        data.append('\n');
                    }
                    data.append(stripOneSpace(line.substring("data:".length())));
                }
            }

            if (!seenAny) return null;
            if (data != null) return new Event(eventType, data.toString());
            if (line == null) return null;
        }
    }

    private static String stripOneSpace(String s) {
        return s.startsWith(" ") ? s.substring(1) : s;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
