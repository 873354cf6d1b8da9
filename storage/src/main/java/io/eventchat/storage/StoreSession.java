// file: src/main/java/io/eventchat/storage/StoreSession.java
package io.eventchat.storage;

import java.util.List;
import java.util.Optional;

/**
 * Conversation-scoped handle to the store.
 * <p>
 * Semantics:
 *  - Lookups return empty when the row does not exist.
 *  - Writes are durable once they return.
 *  - Any call may throw {@link StoreException}; after {@link #close()} every call does.
 */
public interface StoreSession extends AutoCloseable {

    Optional<Conversation> findConversation(long conversationId);

    Optional<UserProfile> findUser(long userId);

    Optional<StoredMessage> findMessage(long messageId);

    /**
     * The most recent {@code limit} messages of a conversation, tombstones included,
     * returned oldest first.
     */
    List<StoredMessage> loadRecentMessages(long conversationId, int limit);

    /** Persist a new message; the store assigns id and creation time. */
    StoredMessage persistMessage(long conversationId, long authorId, String content);

    /**
     * Record that {@code userId} has read {@code messageId}.
     *
     * @return true if this receipt is new, false if it was already recorded
     */
    boolean recordReadReceipt(long messageId, long userId);

    boolean hasRead(long messageId, long userId);

    /** Mark a message deleted and return the tombstone. */
    StoredMessage softDelete(long messageId);

    @Override
    void close();
}
