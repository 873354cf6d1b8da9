package io.eventchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.eventchat.core.MessageVersion;

import java.time.Instant;
import java.util.Map;

/**
 * One message as sent in {@code initial_messages} and {@code new_message}.
 * The vector clock serializes with string keys, as JSON objects require.
 */
public record MessageView(
        long id,
        String content,
        @JsonProperty("is_deleted") boolean isDeleted,
        Instant createdAt,
        Map<Long, Integer> vectorClock,
        int version,
        @JsonProperty("is_read_by_me") boolean isReadByMe,
        UserView user
) {
    /**
     * Combine a synchronizer version with what the store says about the message.
     * Deleted messages are sent with empty content.
     */
    public static MessageView of(MessageVersion v, boolean deleted, boolean readByMe, UserView author) {
        return new MessageView(
                v.messageId(),
                deleted ? "" : v.content(),
                deleted,
                v.createdAt(),
                v.clock(),
                v.version(),
                readByMe,
                author
        );
    }
}
