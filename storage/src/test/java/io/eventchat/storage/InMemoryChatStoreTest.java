package io.eventchat.storage;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * In-memory store: ordering of history, read receipts, tombstones, session lifecycle.
 */
class InMemoryChatStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private static InMemoryChatStore newStore() {
        var store = new InMemoryChatStore(Clock.fixed(T0, ZoneOffset.UTC));
        store.addUser(new UserProfile(1, "Ada", "ada@example.com", null, true));
        store.addConversation(new Conversation(10, 1, Set.of(2L, 3L), null));
        return store;
    }

    @Test
    void recent_messages_are_the_newest_tail_oldest_first() {
        var store = newStore();
        for (int i = 1; i <= 5; i++) {
            store.addMessage(new StoredMessage(i, 10, 2, "m" + i, T0.plusSeconds(i), false));
        }
        store.addMessage(new StoredMessage(6, 99, 2, "elsewhere", T0.plusSeconds(6), false));

        try (StoreSession s = store.openSession()) {
            List<StoredMessage> recent = s.loadRecentMessages(10, 3);
            assertEquals(List.of(3L, 4L, 5L), recent.stream().map(StoredMessage::id).toList());
        }
    }

    @Test
    void persisted_ids_continue_above_seeded_ones() {
        var store = newStore();
        store.addMessage(new StoredMessage(41, 10, 2, "seed", T0, false));

        try (StoreSession s = store.openSession()) {
            StoredMessage m = s.persistMessage(10, 2, "hello");
            assertEquals(42, m.id());
            assertEquals(T0, m.createdAt());
        }
    }

    @Test
    void persisting_into_unknown_conversation_fails() {
        var store = newStore();
        try (StoreSession s = store.openSession()) {
            assertThrows(StoreException.class, () -> s.persistMessage(77, 2, "x"));
        }
    }

    @Test
    void read_receipt_is_new_only_once() {
        var store = newStore();
        try (StoreSession s = store.openSession()) {
            long id = s.persistMessage(10, 2, "hello").id();
            assertTrue(s.recordReadReceipt(id, 3));
            assertFalse(s.recordReadReceipt(id, 3));
            assertTrue(s.hasRead(id, 3));
            assertFalse(s.hasRead(id, 2));
        }
    }

    @Test
    void soft_delete_keeps_a_tombstone() {
        var store = newStore();
        try (StoreSession s = store.openSession()) {
            long id = s.persistMessage(10, 2, "secret").id();
            s.softDelete(id);

            StoredMessage m = s.findMessage(id).orElseThrow();
            assertTrue(m.deleted());
            assertEquals("", m.visibleContent());
            assertEquals(1, s.loadRecentMessages(10, 50).size());
        }
    }

    @Test
    void closed_session_rejects_calls_and_is_counted_once() {
        var store = newStore();
        StoreSession s = store.openSession();
        assertEquals(1, store.openSessions());

        s.close();
        s.close();

        assertEquals(0, store.openSessions());
        assertThrows(StoreException.class, () -> s.findConversation(10));
    }

    @Test
    void owner_is_member_without_being_participant() {
        var c = new Conversation(10, 1, Set.of(2L), T0);
        assertTrue(c.isMember(1));
        assertTrue(c.isMember(2));
        assertFalse(c.isMember(3));
        assertEquals(Set.of(1L, 2L), c.members());
        assertFalse(c.isReadOnlyAt(T0.minusSeconds(1)));
        assertTrue(c.isReadOnlyAt(T0));
    }

    @Test
    void display_name_falls_back_to_email() {
        assertEquals("ada@example.com", new UserProfile(1, "", "ada@example.com", null, false).displayName());
        assertEquals("Ada", new UserProfile(1, "Ada", "ada@example.com", null, false).displayName());
    }
}
