package io.eventchat.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior of the per-author clock: ticking, absorbing, comparing.
 */
class VectorClockTest {

    @Test
    void fresh_clock_starts_owner_at_zero() {
        var c = new VectorClock(7);
        assertEquals(Map.of(7L, 0), c.snapshot());
        assertEquals(0, c.counter(99));
    }

    @Test
    void tick_increments_only_the_owner() {
        var c = new VectorClock(1, Map.of(2L, 5));
        assertEquals(1, c.tick());
        assertEquals(2, c.tick());
        assertEquals(Map.of(1L, 2, 2L, 5), c.snapshot());
    }

    @Test
    void update_takes_pointwise_max_then_ticks_owner() {
        var c = new VectorClock(1, Map.of(1L, 2, 2L, 1));
        c.update(Map.of(2L, 4, 3L, 1));
        assertEquals(Map.of(1L, 3, 2L, 4, 3L, 1), c.snapshot());
    }

    @Test
    void update_is_not_idempotent_for_the_owner() {
        var c = new VectorClock(1);
        c.update(Map.of(2L, 1));
        c.update(Map.of(2L, 1));
        assertEquals(2, c.counter(1));
        assertEquals(1, c.counter(2));
    }

    @Test
    void update_never_lowers_a_counter() {
        var c = new VectorClock(1, Map.of(2L, 9));
        c.update(Map.of(2L, 3));
        assertEquals(9, c.counter(2));
    }

    @Test
    void compare_detects_dominance_in_both_directions() {
        var a = new VectorClock(1, Map.of(1L, 1, 2L, 2));
        var b = new VectorClock(2, Map.of(1L, 1, 2L, 1));

        assertEquals(CausalOrder.LEFT_DOMINATES_RIGHT, a.compare(b.snapshot()));
        assertEquals(CausalOrder.RIGHT_DOMINATES_LEFT, b.compare(a.snapshot()));
        assertTrue(b.happensBefore(a.snapshot()));
        assertFalse(a.happensBefore(b.snapshot()));
    }

    @Test
    void compare_treats_missing_entries_as_zero() {
        var a = new VectorClock(1, Map.of(1L, 3));
        assertEquals(CausalOrder.EQUAL, a.compare(Map.of(1L, 3, 2L, 0)));
    }

    @Test
    void concurrency_when_neither_dominates() {
        var a = new VectorClock(1, Map.of(1L, 3));
        var b = Map.of(1L, 2, 2L, 1);
        assertTrue(a.concurrent(b));
        assertEquals(CausalOrder.CONCURRENT, a.compare(b).swap());
    }

    @Test
    void copy_is_independent_of_the_source() {
        var a = new VectorClock(1);
        var b = a.copy();
        a.tick();
        assertEquals(0, b.counter(1));
    }

    @Test
    void negative_counters_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new VectorClock(1, Map.of(2L, -1)));
        var c = new VectorClock(1);
        assertThrows(IllegalArgumentException.class, () -> c.update(Map.of(2L, -4)));
    }

    @Test
    void max_counter_of_empty_clock_is_zero() {
        assertEquals(0, VectorClock.maxCounter(Map.of()));
        assertEquals(4, VectorClock.maxCounter(Map.of(1L, 2, 3L, 4)));
    }
}
