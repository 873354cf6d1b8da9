// file: src/main/java/io/eventchat/server/protocol/InboundFrame.java
package io.eventchat.server.protocol;

import io.eventchat.core.MessageVersion;

import java.util.Objects;

/**
 * Closed set of frames a client may send on a conversation channel.
 * Decoded once at the transport boundary by {@link FrameCodec#decode(String)}.
 */
public sealed interface InboundFrame
        permits InboundFrame.PostMessage, InboundFrame.SyncMessage, InboundFrame.Typing,
                InboundFrame.PresencePing, InboundFrame.MarkRead {

    int MAX_CONTENT_LENGTH = 1000;

    /** Wire tag of this frame, e.g. {@code "message"}. */
    String type();

    /**
     * {@code {"type":"message","content":"..."}}. Content is already trimmed;
     * range is checked by {@link #requireValidContent()} once the session has
     * decided the conversation still accepts messages.
     */
    record PostMessage(String content) implements InboundFrame {
        public PostMessage {
            Objects.requireNonNull(content, "content");
        }

        public String type() { return "message"; }

        /** Length is counted in code points, so a surrogate pair is one character. */
        public String requireValidContent() {
            int length = content.codePointCount(0, content.length());
            if (length == 0 || length > MAX_CONTENT_LENGTH) {
                throw new FrameFormatException(
                        "message content must be 1.." + MAX_CONTENT_LENGTH + " chars, got " + length);
            }
            return content;
        }
    }

    /** {@code {"type":"sync_message","message":{id, vector_clock, content, user_id, created_at}}}. */
    record SyncMessage(MessageVersion version) implements InboundFrame {
        public SyncMessage {
            Objects.requireNonNull(version, "version");
        }

        public String type() { return "sync_message"; }
    }

    record Typing() implements InboundFrame {
        public String type() { return "typing"; }
    }

    record PresencePing() implements InboundFrame {
        public String type() { return "presence_ping"; }
    }

    record MarkRead(long messageId) implements InboundFrame {
        public String type() { return "mark_read"; }
    }
}
