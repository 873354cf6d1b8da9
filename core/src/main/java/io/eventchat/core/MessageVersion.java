// file: src/main/java/io/eventchat/core/MessageVersion.java
package io.eventchat.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one chat message at one logical time.
 * <p>
 * Fields:
 *  - messageId:   identity of the persisted message this version describes.
 *  - clock:       full vector-clock snapshot (authorId -> counter) at creation.
 *  - content:     message text; empty when the message is a tombstone.
 *  - authorId:    user that authored this version.
 *  - createdAt:   wall-clock creation time, used for ordering and
 *                 last-writer-wins tie-breaking only.
 *  - version:     scalar proxy for causal progress: max counter in {@code clock}.
 * <p>
 * Two versions with the same messageId are successive edits or merges of one
 * logical message. Equality covers every field, so re-delivering the same
 * version is recognisable as a duplicate.
 */
public final class MessageVersion {
    private final long messageId;
    private final Map<Long, Integer> clock;
    private final String content;
    private final long authorId;
    private final Instant createdAt;
    private final int version;

    public MessageVersion(long messageId, Map<Long, Integer> clock, String content, long authorId, Instant createdAt) {
        this.messageId = messageId;
        this.clock = Map.copyOf(Objects.requireNonNull(clock, "clock"));
        this.content = content == null ? "" : content;
        this.authorId = authorId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.version = VectorClock.maxCounter(this.clock);
    }

    public long messageId() { return messageId; }

    /** Read-only clock snapshot. */
    public Map<Long, Integer> clock() { return clock; }

    public String content() { return content; }

    public long authorId() { return authorId; }

    public Instant createdAt() { return createdAt; }

    public int version() { return version; }

    public boolean tombstone() { return content.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageVersion mv)) return false;
        return messageId == mv.messageId
                && authorId == mv.authorId
                && clock.equals(mv.clock)
                && content.equals(mv.content)
                && createdAt.equals(mv.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, clock, content, authorId, createdAt);
    }

    @Override
    public String toString() {
        return "MessageVersion{id=" + messageId
                + ", author=" + authorId
                + ", version=" + version
                + ", clock=" + clock
                + ", createdAt=" + createdAt + "}";
    }
}
