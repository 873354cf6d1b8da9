package io.eventchat.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SynchronizerRegistryTest {

    @Test
    void same_key_returns_the_same_instance() {
        var registry = new SynchronizerRegistry();
        var a = registry.forConversation(ConversationKind.EVENT, "5");
        var b = registry.forConversation(ConversationKey.event(5));
        assertSame(a, b);
        assertEquals(1, registry.size());
    }

    @Test
    void kinds_partition_the_id_space() {
        var registry = new SynchronizerRegistry();
        var event = registry.forConversation(ConversationKind.EVENT, "5");
        var group = registry.forConversation(ConversationKind.GROUP, "5");
        assertNotSame(event, group);
        assertEquals(2, registry.size());
    }

    @Test
    void blank_ids_are_rejected() {
        var registry = new SynchronizerRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.forConversation(ConversationKind.GROUP, " "));
    }
}
