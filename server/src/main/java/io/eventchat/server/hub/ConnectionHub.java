// file: src/main/java/io/eventchat/server/hub/ConnectionHub.java
package io.eventchat.server.hub;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of live connections per conversation plus ephemeral presence and typing state.
 * <p>
 * Responsibilities:
 *  - At most one connection per (conversation, participant); a reconnect replaces the old entry.
 *  - Fan a payload out to a conversation, optionally skipping one participant.
 *  - Track "last seen" per participant (global, not per conversation) and
 *    "last typed" per (conversation, participant).
 * <p>
 * Invariants:
 *  - A broadcast never mutates the connection map while iterating it; recipients
 *    whose send failed are removed after the pass completes.
 *  - Typing entries older than the typing timeout are never reported and are
 *    pruned when listed.
 *  - Presence entries at or past the presence timeout are pruned whenever presence
 *    is touched or listed, so the map holds recently active participants only.
 * <p>
 * Not thread safe: confined to the chat loop thread.
 */
public final class ConnectionHub {
    private static final Logger log = Logger.getLogger(ConnectionHub.class.getName());

    public static final Duration DEFAULT_PRESENCE_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_TYPING_TIMEOUT = Duration.ofSeconds(3);

    private final Clock clock;
    private final Duration presenceTimeout;
    private final Duration typingTimeout;

    private final Map<Long, Map<Long, Connection>> connections = new HashMap<>();
    private final Map<Long, Instant> lastSeen = new HashMap<>();
    private final Map<Long, Map<Long, Instant>> typing = new HashMap<>();

    public ConnectionHub(Clock clock) {
        this(clock, DEFAULT_PRESENCE_TIMEOUT, DEFAULT_TYPING_TIMEOUT);
    }

    public ConnectionHub(Clock clock, Duration presenceTimeout, Duration typingTimeout) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.presenceTimeout = Objects.requireNonNull(presenceTimeout, "presenceTimeout");
        this.typingTimeout = Objects.requireNonNull(typingTimeout, "typingTimeout");
    }

    public Instant now() {
        return clock.instant();
    }

    // ---------- connections ----------

    /** Insert or replace the participant's connection for this conversation. */
    public void register(long conversationId, long participantId, Connection connection) {
        Objects.requireNonNull(connection, "connection");
        connections.computeIfAbsent(conversationId, k -> new LinkedHashMap<>()).put(participantId, connection);
    }

    /** Remove the participant's entry if present. Idempotent. */
    public void unregister(long conversationId, long participantId) {
        Map<Long, Connection> byParticipant = connections.get(conversationId);
        if (byParticipant == null) return;
        byParticipant.remove(participantId);
        if (byParticipant.isEmpty()) connections.remove(conversationId);
    }

    /**
     * Remove the participant's entry only while it still maps to {@code connection}.
     *
     * @return true if an entry was removed
     */
    public boolean unregister(long conversationId, long participantId, Connection connection) {
        Map<Long, Connection> byParticipant = connections.get(conversationId);
        if (byParticipant == null) return false;
        boolean removed = byParticipant.remove(participantId, connection);
        if (byParticipant.isEmpty()) connections.remove(conversationId);
        return removed;
    }

    /**
     * Send {@code payload} to every connection of the conversation except
     * {@code excludeParticipantId} (null sends to all).
     *
     * @return number of successful sends
     */
    public int broadcast(long conversationId, Long excludeParticipantId, String payload) {
        Map<Long, Connection> byParticipant = connections.get(conversationId);
        if (byParticipant == null) return 0;

        int delivered = 0;
        List<Map.Entry<Long, Connection>> failed = new ArrayList<>();
        for (Map.Entry<Long, Connection> e : byParticipant.entrySet()) {
            if (excludeParticipantId != null && e.getKey().equals(excludeParticipantId)) continue;
            try {
                e.getValue().send(payload);
                delivered++;
            } catch (IOException | RuntimeException ex) {
                log.log(Level.WARNING, "send to participant " + e.getKey()
                        + " in conversation " + conversationId + " failed; dropping connection", ex);
                failed.add(Map.entry(e.getKey(), e.getValue()));
            }
        }

        for (Map.Entry<Long, Connection> dead : failed) {
            unregister(conversationId, dead.getKey(), dead.getValue());
        }
        return delivered;
    }

    public boolean isConnected(long conversationId, long participantId) {
        Map<Long, Connection> byParticipant = connections.get(conversationId);
        return byParticipant != null && byParticipant.containsKey(participantId);
    }

    /** Participant ids with a live entry, in registration order. */
    public List<Long> connectedParticipants(long conversationId) {
        Map<Long, Connection> byParticipant = connections.get(conversationId);
        return byParticipant == null ? List.of() : List.copyOf(byParticipant.keySet());
    }

    // ---------- presence ----------

    public void touchPresence(long participantId) {
        Instant now = clock.instant();
        pruneExpiredPresence(now);
        lastSeen.put(participantId, now);
    }

    /** Drop every participant whose last activity is at or past the presence timeout. */
    public void pruneExpiredPresence(Instant now) {
        lastSeen.values().removeIf(seen -> Duration.between(seen, now).compareTo(presenceTimeout) >= 0);
    }

    int trackedPresenceCount() {
        return lastSeen.size();
    }

    /** Seen strictly less than the presence timeout ago. */
    public boolean isOnline(long participantId, Instant now) {
        Instant seen = lastSeen.get(participantId);
        return seen != null && Duration.between(seen, now).compareTo(presenceTimeout) < 0;
    }

    /** Connected participants of the conversation that are online, minus {@code excludeParticipantId}. */
    public List<Long> onlineParticipants(long conversationId, Instant now, Long excludeParticipantId) {
        pruneExpiredPresence(now);
        List<Long> online = new ArrayList<>();
        for (Long pid : connectedParticipants(conversationId)) {
            if (pid.equals(excludeParticipantId)) continue;
            if (isOnline(pid, now)) online.add(pid);
        }
        return online;
    }

    // ---------- typing ----------

    public void setTyping(long conversationId, long participantId) {
        typing.computeIfAbsent(conversationId, k -> new LinkedHashMap<>()).put(participantId, clock.instant());
    }

    /**
     * Participants who typed within the typing timeout, minus {@code excludeParticipantId}.
     * Expired entries are removed as a side effect.
     */
    public List<Long> listTyping(long conversationId, Instant now, Long excludeParticipantId) {
        Map<Long, Instant> byParticipant = typing.get(conversationId);
        if (byParticipant == null) return List.of();

        byParticipant.values().removeIf(at -> Duration.between(at, now).compareTo(typingTimeout) > 0);
        if (byParticipant.isEmpty()) {
            typing.remove(conversationId);
            return List.of();
        }

        List<Long> result = new ArrayList<>();
        for (Long pid : byParticipant.keySet()) {
            if (!pid.equals(excludeParticipantId)) result.add(pid);
        }
        return result;
    }
}
