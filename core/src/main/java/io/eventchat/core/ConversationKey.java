package io.eventchat.core;

import java.util.Objects;

/**
 * Identity of one conversation: (kind, id).
 */
public record ConversationKey(ConversationKind kind, String id) {

    public ConversationKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("conversation id must not be blank");
    }

    public static ConversationKey event(long eventId) {
        return new ConversationKey(ConversationKind.EVENT, Long.toString(eventId));
    }

    @Override
    public String toString() {
        return kind.label() + ":" + id;
    }
}
