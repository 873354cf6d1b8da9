package io.eventchat.server.relay;

import java.util.Objects;

/**
 * "Send {@code payload} to conversation {@code conversationId}", handed from a
 * worker thread to the chat loop.
 *
 * @param excludeParticipantId participant to skip, or null for everyone
 */
public record BroadcastCommand(long conversationId, Long excludeParticipantId, String payload) {
    public BroadcastCommand {
        Objects.requireNonNull(payload, "payload");
    }
}
