// file: src/main/java/io/eventchat/core/SynchronizerRegistry.java
package io.eventchat.core;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map from {@link ConversationKey} to its {@link MessageSynchronizer}.
 * <p>
 * Synchronizers are created lazily on first access and cached for the lifetime
 * of the registry. There is no eviction: clocks cannot be rebuilt mid-session
 * without replaying history, so an entry lives as long as the process.
 */
public final class SynchronizerRegistry {

    private final Map<ConversationKey, MessageSynchronizer> synchronizers = new ConcurrentHashMap<>();

    /** Get or create the synchronizer for {@code key}. */
    public MessageSynchronizer forConversation(ConversationKey key) {
        Objects.requireNonNull(key, "key");
        return synchronizers.computeIfAbsent(key, MessageSynchronizer::new);
    }

    public MessageSynchronizer forConversation(ConversationKind kind, String id) {
        return forConversation(new ConversationKey(kind, id));
    }

    public int size() {
        return synchronizers.size();
    }
}
