package io.eventchat.core;

import java.util.Map;

/**
 * Point-in-time view of a synchronizer: every author's clock and the current
 * version per message id. Both maps are immutable copies.
 */
public record SyncState(
        ConversationKey conversation,
        Map<Long, Map<Long, Integer>> clocks,
        Map<Long, MessageVersion> versions
) {
    public SyncState {
        clocks = Map.copyOf(clocks);
        versions = Map.copyOf(versions);
    }
}
