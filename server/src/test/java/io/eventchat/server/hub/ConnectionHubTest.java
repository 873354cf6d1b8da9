package io.eventchat.server.hub;

import io.eventchat.server.MutableClock;
import io.eventchat.server.RecordingConnection;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fan-out, reconnect replacement, presence and typing expiry.
 */
class ConnectionHubTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    private final ConnectionHub hub = new ConnectionHub(clock);

    @Test
    void broadcast_skips_only_the_excluded_participant() {
        var a = new RecordingConnection("a");
        var b = new RecordingConnection("b");
        var c = new RecordingConnection("c");
        hub.register(1, 10, a);
        hub.register(1, 20, b);
        hub.register(1, 30, c);

        assertEquals(2, hub.broadcast(1, 20L, "x"));
        assertEquals(List.of("x"), a.sent());
        assertTrue(b.sent().isEmpty());
        assertEquals(List.of("x"), c.sent());

        assertEquals(3, hub.broadcast(1, null, "y"));
        assertEquals("y", b.last());
    }

    @Test
    void broadcast_is_scoped_to_the_conversation() {
        var a = new RecordingConnection("a");
        var other = new RecordingConnection("other");
        hub.register(1, 10, a);
        hub.register(2, 10, other);

        hub.broadcast(1, null, "x");

        assertTrue(other.sent().isEmpty());
        assertEquals(0, hub.broadcast(99, null, "nobody"));
    }

    @Test
    void failed_recipients_are_removed_after_the_pass() {
        var good = new RecordingConnection("good");
        var dead = new RecordingConnection("dead");
        var alsoGood = new RecordingConnection("alsoGood");
        dead.failSends();
        hub.register(1, 10, good);
        hub.register(1, 20, dead);
        hub.register(1, 30, alsoGood);

        assertEquals(2, hub.broadcast(1, null, "x"));

        assertEquals(List.of("x"), good.sent());
        assertEquals(List.of("x"), alsoGood.sent());
        assertFalse(hub.isConnected(1, 20));
        assertEquals(List.of(10L, 30L), hub.connectedParticipants(1));
    }

    @Test
    void register_replaces_an_existing_entry() {
        var first = new RecordingConnection("first");
        var second = new RecordingConnection("second");
        hub.register(1, 10, first);
        hub.register(1, 10, second);

        hub.broadcast(1, null, "x");

        assertTrue(first.sent().isEmpty());
        assertEquals(List.of("x"), second.sent());
    }

    @Test
    void unregister_is_idempotent() {
        hub.register(1, 10, new RecordingConnection("a"));
        hub.unregister(1, 10);
        hub.unregister(1, 10);
        hub.unregister(5, 10);
        assertFalse(hub.isConnected(1, 10));
    }

    @Test
    void conditional_unregister_keeps_a_newer_connection() {
        var stale = new RecordingConnection("stale");
        var fresh = new RecordingConnection("fresh");
        hub.register(1, 10, stale);
        hub.register(1, 10, fresh);

        assertFalse(hub.unregister(1, 10, stale));
        assertTrue(hub.isConnected(1, 10));
        assertTrue(hub.unregister(1, 10, fresh));
        assertFalse(hub.isConnected(1, 10));
    }

    @Test
    void presence_expires_after_timeout() {
        hub.touchPresence(10);
        assertTrue(hub.isOnline(10, clock.instant()));

        clock.advance(Duration.ofSeconds(299));
        assertTrue(hub.isOnline(10, clock.instant()));

        clock.advance(Duration.ofSeconds(1));
        assertFalse(hub.isOnline(10, clock.instant()));
        assertFalse(hub.isOnline(99, clock.instant()));
    }

    @Test
    void expired_presence_entries_are_removed_not_just_reported_offline() {
        for (long pid = 1; pid <= 1000; pid++) {
            hub.touchPresence(pid);
        }
        assertEquals(1000, hub.trackedPresenceCount());

        clock.advance(Duration.ofSeconds(301));
        hub.touchPresence(5000);

        assertEquals(1, hub.trackedPresenceCount());
        assertTrue(hub.isOnline(5000, clock.instant()));
        assertFalse(hub.isOnline(1, clock.instant()));
    }

    @Test
    void listing_online_participants_prunes_expired_presence() {
        hub.register(1, 10, new RecordingConnection("a"));
        hub.touchPresence(10);
        hub.touchPresence(20);

        clock.advance(Duration.ofSeconds(300));

        assertEquals(List.of(), hub.onlineParticipants(1, clock.instant(), null));
        assertEquals(0, hub.trackedPresenceCount());
    }

    @Test
    void online_participants_are_connected_fresh_and_not_the_caller() {
        hub.register(1, 10, new RecordingConnection("a"));
        hub.register(1, 20, new RecordingConnection("b"));
        hub.register(1, 30, new RecordingConnection("c"));
        hub.touchPresence(10);
        hub.touchPresence(20);
        hub.touchPresence(40); // online but not connected here

        assertEquals(List.of(20L), hub.onlineParticipants(1, clock.instant(), 10L));
    }

    @Test
    void typing_entries_expire_and_are_pruned() {
        hub.setTyping(1, 10);
        clock.advance(Duration.ofSeconds(2));
        hub.setTyping(1, 20);

        assertEquals(List.of(10L, 20L), hub.listTyping(1, clock.instant(), null));
        assertEquals(List.of(10L), hub.listTyping(1, clock.instant(), 20L));

        clock.advance(Duration.ofMillis(1500));
        assertEquals(List.of(20L), hub.listTyping(1, clock.instant(), null));

        clock.advance(Duration.ofSeconds(5));
        assertEquals(List.of(), hub.listTyping(1, clock.instant(), null));
    }
}
