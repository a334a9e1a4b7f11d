package io.chatstream.client;

import io.chatstream.core.content.AttachmentRef;
import io.chatstream.core.content.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A role-tagged input message.
 *
 * <p>A message with a single text part is written in the short form {@code "content": "..."}.
 */
public record InputItem(Role role, List<InputContent> content) {
    public InputItem {
        Objects.requireNonNull(role, "role");
        content = List.copyOf(content);
        if (content.isEmpty()) {
            throw new IllegalArgumentException("input item needs at least one content part");
        }
    }

    public static InputItem user(String text) {
        return new InputItem(Role.USER, List.of(new InputContent.Text(text)));
    }

    public static InputItem assistant(String text) {
        return new InputItem(Role.ASSISTANT, List.of(new InputContent.Text(text)));
    }

    /**
     * A user message with attachments. Blank text is left out.
     */
    public static InputItem user(String text, List<AttachmentRef> attachments) {
        if (attachments.isEmpty()) {
            return user(text);
        }
        List<InputContent> parts = new ArrayList<>();
        if (text != null && !text.isBlank()) {
            parts.add(new InputContent.Text(text));
        }
        for (AttachmentRef a : attachments) {
            parts.add(InputContent.of(a));
        }
        return new InputItem(Role.USER, parts);
    }

    boolean isPlainText() {
        return content.size() == 1 && content.get(0) instanceof InputContent.Text;
    }
}
