// file: src/main/java/io/eventchat/core/MessageSynchronizer.java
package io.eventchat.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Causal message synchronizer for one conversation.
 * <p>
 * Responsibilities:
 *  - Own one {@link VectorClock} per author seen in the conversation.
 *  - Mint versions for locally posted messages ({@link #createVersion}).
 *  - Rebuild clocks from persisted history on connect ({@link #initializeVersion}).
 *  - Merge versions coming back from clients ({@link #merge}), resolving
 *    concurrent edits with a {@link ConflictResolver}.
 *  - Produce a stable replay order ({@link #orderedMessages}).
 * <p>
 * Invariant: at most one MessageVersion is stored per message id, the one the
 * merge rules selected.
 * <p>
 * Not thread safe. A synchronizer is only touched from the chat loop thread.
 */
public final class MessageSynchronizer {
    private static final Logger log = Logger.getLogger(MessageSynchronizer.class.getName());

    /** Replay order: scalar version, then wall clock, then id. */
    static final Comparator<MessageVersion> REPLAY_ORDER = Comparator
            .comparingInt(MessageVersion::version)
            .thenComparing(MessageVersion::createdAt)
            .thenComparingLong(MessageVersion::messageId);

    private final ConversationKey conversation;
    private final ConflictResolver resolver;
    private final Map<Long, VectorClock> clocks = new HashMap<>();
    private final Map<Long, MessageVersion> versions = new HashMap<>();

    public MessageSynchronizer(ConversationKey conversation) {
        this(conversation, new ConflictResolver.LastWriterWins());
    }

    public MessageSynchronizer(ConversationKey conversation, ConflictResolver resolver) {
        this.conversation = Objects.requireNonNull(conversation, "conversation");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public ConversationKey conversation() {
        return conversation;
    }

    /**
     * Mint a version for a message the author just posted.
     * <p>
     * Ticks the author's clock and stores the new version as current for
     * {@code messageId}. An existing entry for the same id is overwritten,
     * which is how an author's edit of a just-sent message replaces it.
     */
    public MessageVersion createVersion(long messageId, long authorId, String content, Instant createdAt) {
        VectorClock clock = clockFor(authorId);
        clock.tick();
        MessageVersion v = new MessageVersion(messageId, clock.snapshot(), content, authorId, createdAt);
        versions.put(messageId, v);
        return v;
    }

    /**
     * Register a message loaded from persisted history.
     * <p>
     * For an unknown id:
     *  1) If the author already has initialized messages, fold the clock of the
     *     most recent one (by createdAt) into the author's clock via update.
     *  2) Tick the author's clock and snapshot it into the new version.
     * <p>
     * For a known id the clocks are left alone and the stored version keeps its
     * clock snapshot; content and timestamp are refreshed from history so a
     * soft delete shows up as a tombstone. Replaying the same history twice is
     * therefore safe. The author's current clock is not re-snapshotted, so a
     * known message never picks up ticks from messages initialized after it.
     */
    public MessageVersion initializeVersion(long messageId, long authorId, String content, Instant createdAt) {
        MessageVersion known = versions.get(messageId);
        Map<Long, Integer> snapshot;
        if (known == null) {
            VectorClock clock = clockFor(authorId);
            latestByAuthor(authorId).ifPresent(latest -> clock.update(latest.clock()));
            clock.tick();
            snapshot = clock.snapshot();
        } else {
            snapshot = known.clock();
        }
        MessageVersion v = new MessageVersion(messageId, snapshot, content, authorId, createdAt);
        versions.put(messageId, v);
        return v;
    }

    /**
     * Merge a version received from a client (reconnect replay or cross-client sync).
     * <p>
     * State machine over one message id:
     *  - absent:                              accept; every author in the snapshot
     *                                         absorbs its own counter.
     *  - incoming.version > stored.version:   accept as newer; the incoming author's
     *                                         clock absorbs the whole snapshot.
     *  - equal version, identical version:    duplicate, ignored.
     *  - equal version, any other difference: concurrent edit; the resolver picks
     *                                         the winner, which is stored and returned
     *                                         with isNew=true.
     *  - incoming.version < stored.version:   stale, ignored.
     */
    public MergeResult merge(MessageVersion incoming) {
        Objects.requireNonNull(incoming, "incoming");
        MessageVersion existing = versions.get(incoming.messageId());

        if (existing == null) {
            for (Map.Entry<Long, Integer> e : incoming.clock().entrySet()) {
                clockFor(e.getKey()).update(Map.of(e.getKey(), e.getValue()));
            }
            versions.put(incoming.messageId(), incoming);
            return MergeResult.accepted(incoming);
        }

        if (incoming.version() > existing.version()) {
            clockFor(incoming.authorId()).update(incoming.clock());
            versions.put(incoming.messageId(), incoming);
            return MergeResult.accepted(incoming);
        }

        if (incoming.version() == existing.version()) {
            if (incoming.equals(existing)) {
                return MergeResult.ignored(existing);
            }
            MessageVersion winner = resolver.choose(existing, incoming);
            versions.put(incoming.messageId(), winner);
            return MergeResult.accepted(winner);
        }

        log.log(Level.FINE, () -> "stale version ignored for message " + incoming.messageId()
                + " in " + conversation + ": " + incoming.version() + " < " + existing.version());
        return MergeResult.ignored(existing);
    }

    /**
     * Merge a batch of remote versions.
     *
     * @return the versions that were accepted, in input order
     */
    public List<MessageVersion> syncWithRemote(List<MessageVersion> remote) {
        List<MessageVersion> updated = new ArrayList<>();
        for (MessageVersion v : remote) {
            if (v == null) {
                log.warning("skipping null version in remote batch for " + conversation);
                continue;
            }
            MergeResult r = merge(v);
            if (r.isNew()) {
                updated.add(r.version());
            }
        }
        return updated;
    }

    /**
     * The most recent {@code limit} stored versions in replay order.
     * <p>
     * Sort key is (version, createdAt, messageId) ascending. This approximates
     * causal order; it is not a topological sort of happens-before.
     *
     * @param limit maximum number of entries; 0 returns everything
     */
    public List<MessageVersion> orderedMessages(int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        List<MessageVersion> sorted = new ArrayList<>(versions.values());
        sorted.sort(REPLAY_ORDER);
        if (limit == 0 || sorted.size() <= limit) {
            return List.copyOf(sorted);
        }
        return List.copyOf(sorted.subList(sorted.size() - limit, sorted.size()));
    }

    public Optional<MessageVersion> current(long messageId) {
        return Optional.ofNullable(versions.get(messageId));
    }

    /** Snapshot of {@code authorId}'s clock, or an empty map if the author is unknown. */
    public Map<Long, Integer> authorClock(long authorId) {
        VectorClock c = clocks.get(authorId);
        return c == null ? Map.of() : c.snapshot();
    }

    public int size() {
        return versions.size();
    }

    /** Immutable view of all clocks and current versions, for diagnostics and client sync. */
    public SyncState syncState() {
        Map<Long, Map<Long, Integer>> clockView = new HashMap<>();
        clocks.forEach((author, clock) -> clockView.put(author, clock.snapshot()));
        return new SyncState(conversation, clockView, versions);
    }

    // ---------- helpers ----------

    private VectorClock clockFor(long authorId) {
        return clocks.computeIfAbsent(authorId, VectorClock::new);
    }

    private Optional<MessageVersion> latestByAuthor(long authorId) {
        return versions.values().stream()
                .filter(v -> v.authorId() == authorId)
                .max(Comparator.comparing(MessageVersion::createdAt));
    }
}
