package io.chatstream.client;

import io.chatstream.core.content.AttachmentRef;

import java.util.Objects;

/**
 * One content part of an {@link InputItem}.
 */
public sealed interface InputContent permits InputContent.Text, InputContent.Image, InputContent.File {

    record Text(String text) implements InputContent {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * @param imageUrl a {@code data:<mime>;base64,...} URL or a remote URL
     */
    record Image(String imageUrl, String detail) implements InputContent {
        public Image {
            Objects.requireNonNull(imageUrl, "imageUrl");
            Objects.requireNonNull(detail, "detail");
        }
    }

    record File(String filename, String base64Data) implements InputContent {
        public File {
            Objects.requireNonNull(filename, "filename");
            Objects.requireNonNull(base64Data, "base64Data");
        }
    }

    /**
     * Images become inline data URLs, everything else is sent as file data.
     */
    static InputContent of(AttachmentRef attachment) {
        Objects.requireNonNull(attachment, "attachment");
        if (attachment.isImage()) {
            return new Image("data:" + attachment.mimeType() + ";base64," + attachment.base64Data(), "auto");
        }
        return new File(attachment.filename(), attachment.base64Data());
    }
}
