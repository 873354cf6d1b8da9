// file: src/main/java/io/eventchat/storage/InMemoryChatStore.java
package io.eventchat.storage;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed {@link ChatStore} for local runs and tests.
 * <p>
 * Responsibilities:
 *  - Hold users, conversations, messages and read receipts in plain maps.
 *  - Assign message ids from a sequence and creation times from an injectable {@link Clock}.
 *  - Count open sessions so callers can check that every session was released.
 * <p>
 * All access goes through the store monitor: sessions are used from the chat
 * loop thread and from HTTP worker threads.
 */
public class InMemoryChatStore implements ChatStore {
    private final Clock clock;
    private final AtomicLong messageIds = new AtomicLong();
    private final AtomicInteger openSessions = new AtomicInteger();

    private final Map<Long, UserProfile> users = new HashMap<>();
    private final Map<Long, Conversation> conversations = new HashMap<>();
    private final Map<Long, StoredMessage> messages = new HashMap<>();
    private final Map<Long, Set<Long>> readBy = new HashMap<>();

    public InMemoryChatStore() {
        this(Clock.systemUTC());
    }

    public InMemoryChatStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void addUser(UserProfile user) {
        users.put(user.id(), user);
    }

    public synchronized void addConversation(Conversation conversation) {
        conversations.put(conversation.id(), conversation);
    }

    /** Seed a message with a known id; later generated ids continue above it. */
    public synchronized void addMessage(StoredMessage message) {
        messages.put(message.id(), message);
        messageIds.accumulateAndGet(message.id(), Math::max);
    }

    /** Number of sessions opened and not yet closed. */
    public int openSessions() {
        return openSessions.get();
    }

    @Override
    public StoreSession openSession() {
        openSessions.incrementAndGet();
        return new Session();
    }

    private final class Session implements StoreSession {
        private boolean closed;

        @Override
        public Optional<Conversation> findConversation(long conversationId) {
            synchronized (InMemoryChatStore.this) {
                ensureOpen();
                return Optional.ofNullable(conversations.get(conversationId));
            }
        }

        @Override
        public Optional<UserProfile> findUser(long userId) {
            synchronized (InMemoryChatStore.this) {
                ensureOpen();
                return Optional.ofNullable(users.get(userId));
            }
        }

        @Override
        public Optional<StoredMessage> findMessage(long messageId) {
            synchronized (InMemoryChatStore.this) {
                ensureOpen();
                return Optional.ofNullable(messages.get(messageId));
            }
        }

        @Override
        public List<StoredMessage> loadRecentMessages(long conversationId, int limit) {
            if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
            synchronized (InMemoryChatStore.this) {
                ensureOpen();
                List<StoredMessage> inConversation = new ArrayList<>();
                for (StoredMessage m : messages.values()) {
                    if (m.conversationId() == conversationId) inConversation.add(m);
                }
                inConversation.sort(Comparator.comparing(StoredMessage::createdAt)
                        .thenComparingLong(StoredMessage::id));
                int from = Math.max(0, inConversation.size() - limit);
                return List.copyOf(inConversation.subList(from, inConversation.size()));
            }
        }

        @Override
        public StoredMessage persistMessage(long conversationId, long authorId, String content) {
            synchronized (InMemoryChatStore.this) {
                ensureOpen();
                if (!conversations.containsKey(conversationId)) {
                    throw new StoreException("no conversation " + conversationId);
                }
                StoredMessage m = new StoredMessage(
                        messageIds.incrementAndGet(), conversationId, authorId, content, Instant.now(clock), false);
                messages.put(m.id(), m);
                return m;
            }
        }

        @Override
        public boolean recordReadReceipt(long messageId, long userId) {
            synchronized (InMemoryChatStore.this) {
                ensureOpen();
                if (!messages.containsKey(messageId)) {
                    throw new StoreException("no message " + messageId);
                }
                return readBy.computeIfAbsent(messageId, k -> new HashSet<>()).add(userId);
            }
        }

        @Override
        public boolean hasRead(long messageId, long userId) {
            synchronized (InMemoryChatStore.this) {
                ensureOpen();
                return readBy.getOrDefault(messageId, Set.of()).contains(userId);
            }
        }

        @Override
        public StoredMessage softDelete(long messageId) {
            synchronized (InMemoryChatStore.this) {
                ensureOpen();
                StoredMessage m = messages.get(messageId);
                if (m == null) throw new StoreException("no message " + messageId);
                StoredMessage tombstone = m.asDeleted();
                messages.put(messageId, tombstone);
                return tombstone;
            }
        }

        @Override
        public void close() {
            synchronized (InMemoryChatStore.this) {
                if (closed) return;
                closed = true;
            }
            openSessions.decrementAndGet();
        }

        private void ensureOpen() {
            if (closed) throw new StoreException("store session already closed");
        }
    }
}
