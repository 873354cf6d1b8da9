package io.eventchat.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted chat message. Deleted messages stay in the store as tombstones.
 */
public record StoredMessage(
        long id,
        long conversationId,
        long authorId,
        String content,
        Instant createdAt,
        boolean deleted
) {
    public StoredMessage {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /** Content as clients may see it: empty once deleted. */
    public String visibleContent() {
        return deleted ? "" : content;
    }

    public StoredMessage asDeleted() {
        return new StoredMessage(id, conversationId, authorId, content, createdAt, true);
    }
}
