// file: src/main/java/io/eventchat/server/protocol/OutboundFrame.java
package io.eventchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Frames the server sends to clients. Each record's components become the
 * frame's fields (snake_case); {@link FrameCodec#encode} adds the {@code type} tag.
 */
public sealed interface OutboundFrame
        permits OutboundFrame.InitialMessages, OutboundFrame.NewMessage, OutboundFrame.UserJoined,
                OutboundFrame.UserLeft, OutboundFrame.TypingNotice, OutboundFrame.PresenceUpdate,
                OutboundFrame.MessageRead, OutboundFrame.MessageDeleted, OutboundFrame.ErrorNotice {

    String EVENT_ENDED = "This event has ended. Chat is now read-only. You can still view message history.";

    @JsonIgnore
    String type();

    record InitialMessages(List<MessageView> messages) implements OutboundFrame {
        public InitialMessages {
            messages = List.copyOf(messages);
        }

        public String type() { return "initial_messages"; }
    }

    record NewMessage(MessageView message) implements OutboundFrame {
        public String type() { return "new_message"; }
    }

    record UserJoined(long userId, String userName, String userPhotoUrl) implements OutboundFrame {
        public String type() { return "user_joined"; }
    }

    record UserLeft(long userId) implements OutboundFrame {
        public String type() { return "user_left"; }
    }

    record TypingNotice(long userId, String userName) implements OutboundFrame {
        public String type() { return "typing"; }
    }

    record PresenceUpdate(List<Long> onlineUsers) implements OutboundFrame {
        public PresenceUpdate {
            onlineUsers = List.copyOf(onlineUsers);
        }

        public String type() { return "presence_update"; }
    }

    record MessageRead(long messageId, long userId) implements OutboundFrame {
        public String type() { return "message_read"; }
    }

    record MessageDeleted(long messageId) implements OutboundFrame {
        public String type() { return "message_deleted"; }
    }

    record ErrorNotice(String message) implements OutboundFrame {
        public String type() { return "error"; }
    }
}
