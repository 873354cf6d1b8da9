// file: src/main/java/io/eventchat/core/VectorClock.java
package io.eventchat.core;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-author logical clock: a mapping from authorId -> counter, owned by one author.
 * <p>
 * This is the causal metadata a {@link MessageSynchronizer} keeps for every author
 * that has posted in a conversation. Unlike a {@link MessageVersion} snapshot, a
 * clock is mutable and lives as long as its synchronizer.
 * <p>
 * Invariants:
 *  - The owner's own counter only moves forward through {@link #tick()} or {@link #update(Map)}.
 *  - Absorbing another clock's state can raise counters, never lower them.
 *  - Missing entries read as 0.
 * <p>
 * Not thread safe. Clocks are confined to the chat loop thread together with
 * the synchronizer that owns them.
 */
public final class VectorClock {

    private final long ownerId;
    private final Map<Long, Integer> counters;

    /** Fresh clock for {@code ownerId}, with the owner's counter at 0. */
    public VectorClock(long ownerId) {
        this(ownerId, Map.of());
    }

    /**
     * Clock for {@code ownerId} seeded from {@code initialState}.
     * The input map is copied; later changes to it are not observed.
     */
    public VectorClock(long ownerId, Map<Long, Integer> initialState) {
        Objects.requireNonNull(initialState, "initialState");
        this.ownerId = ownerId;
        this.counters = new HashMap<>();
        this.counters.put(ownerId, 0);
        for (Map.Entry<Long, Integer> e : initialState.entrySet()) {
            counters.put(e.getKey(), checkedCounter(e.getKey(), e.getValue()));
        }
    }

    public long ownerId() {
        return ownerId;
    }

    /** Current value of {@code authorId}'s counter (0 if never seen). */
    public int counter(long authorId) {
        return counters.getOrDefault(authorId, 0);
    }

    /**
     * Increment the owner's own counter by 1.
     *
     * @return the new value of the owner's counter
     */
    public int tick() {
        int next = counter(ownerId) + 1;
        counters.put(ownerId, next);
        return next;
    }

    /**
     * Absorb another clock's state, then count the absorption as a local event.
     * <p>
     * Steps:
     *  1) For every author in {@code otherState}, keep max(own, other).
     *  2) Increment the owner's own counter by exactly 1.
     * <p>
     * Step 2 makes update non-idempotent for the owner's counter: two identical
     * updates advance it twice.
     */
    public void update(Map<Long, Integer> otherState) {
        Objects.requireNonNull(otherState, "otherState");
        for (Map.Entry<Long, Integer> e : otherState.entrySet()) {
            int theirs = checkedCounter(e.getKey(), e.getValue());
            counters.merge(e.getKey(), theirs, Math::max);
        }
        counters.put(ownerId, counter(ownerId) + 1);
    }

    /**
     * Compare this clock (A) to {@code other} (B) under the vector-clock partial order.
     * Missing entries on either side are treated as 0.
     */
    public CausalOrder compare(Map<Long, Integer> other) {
        Objects.requireNonNull(other, "other");
        boolean aGreater = false;
        boolean bGreater = false;

        Set<Long> ids = new HashSet<>(counters.keySet());
        ids.addAll(other.keySet());

        for (Long id : ids) {
            int a = counters.getOrDefault(id, 0);
            int b = valueOf(other, id);
            if (a > b) aGreater = true;
            if (a < b) bGreater = true;
            if (aGreater && bGreater) return CausalOrder.CONCURRENT;
        }

        if (!aGreater && !bGreater) return CausalOrder.EQUAL;
        if (aGreater) return CausalOrder.LEFT_DOMINATES_RIGHT;
        return CausalOrder.RIGHT_DOMINATES_LEFT;
    }

    /**
     * True iff this clock is <= {@code other} everywhere and strictly < somewhere.
     * Diagnostic only: replay ordering does not walk the partial order.
     */
    public boolean happensBefore(Map<Long, Integer> other) {
        return compare(other) == CausalOrder.RIGHT_DOMINATES_LEFT;
    }

    /** True iff neither clock happened before the other and they are not equal. */
    public boolean concurrent(Map<Long, Integer> other) {
        return compare(other) == CausalOrder.CONCURRENT;
    }

    /** Immutable copy of the current counters. */
    public Map<Long, Integer> snapshot() {
        return Map.copyOf(counters);
    }

    /** Independent clock with the same owner and counters. */
    public VectorClock copy() {
        return new VectorClock(ownerId, counters);
    }

    /** Scalar "how advanced" proxy: the maximum counter of {@code clock}, or 0 when empty. */
    public static int maxCounter(Map<Long, Integer> clock) {
        int max = 0;
        for (Integer v : clock.values()) {
            if (v != null && v > max) max = v;
        }
        return max;
    }

    private static int valueOf(Map<Long, Integer> clock, Long id) {
        Integer v = clock.get(id);
        return v == null ? 0 : v;
    }

    private static int checkedCounter(Long authorId, Integer value) {
        if (authorId == null) throw new IllegalArgumentException("clock author id must not be null");
        if (value == null || value < 0) {
            throw new IllegalArgumentException("clock counter for " + authorId + " must be >= 0, got " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "VectorClock{owner=" + ownerId + ", " + counters + "}";
    }
}
