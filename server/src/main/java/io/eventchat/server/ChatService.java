// file: src/main/java/io/eventchat/server/ChatService.java
package io.eventchat.server;

import io.eventchat.server.auth.AuthenticationException;
import io.eventchat.server.auth.CredentialVerifier;
import io.eventchat.server.dto.PresenceResponse;
import io.eventchat.server.dto.TypingUsersResponse;
import io.eventchat.server.hub.ConnectionHub;
import io.eventchat.server.loop.ChatEventLoop;
import io.eventchat.server.protocol.FrameCodec;
import io.eventchat.server.protocol.OutboundFrame;
import io.eventchat.server.relay.BroadcastCommand;
import io.eventchat.server.relay.BroadcastRelay;
import io.eventchat.storage.ChatStore;
import io.eventchat.storage.Conversation;
import io.eventchat.storage.StoreSession;
import io.eventchat.storage.StoredMessage;
import io.eventchat.storage.UserProfile;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * REST operations that touch chat state from outside a chat connection.
 * <p>
 * Runs on HTTP worker threads. Hub reads and presence updates go through
 * {@link ChatEventLoop#call}; the delete notification goes through the
 * {@link BroadcastRelay}. Failures surface as {@link ApiException}.
 */
public final class ChatService {
    private static final Logger log = Logger.getLogger(ChatService.class.getName());

    static final Duration LOOP_TIMEOUT = Duration.ofSeconds(5);

    private final ChatStore store;
    private final CredentialVerifier verifier;
    private final ConnectionHub hub;
    private final ChatEventLoop loop;
    private final BroadcastRelay relay;
    private final FrameCodec codec;

    public ChatService(ChatStore store,
                       CredentialVerifier verifier,
                       ConnectionHub hub,
                       ChatEventLoop loop,
                       BroadcastRelay relay,
                       FrameCodec codec) {
        this.store = store;
        this.verifier = verifier;
        this.hub = hub;
        this.loop = loop;
        this.relay = relay;
        this.codec = codec;
    }

    /**
     * Soft-delete a message as its author and tell everyone connected to the event.
     * <p>
     * Order of checks: credential (401), event exists (404), message exists (404),
     * message belongs to the event (400), caller is the author (403).
     */
    public void deleteMessage(long eventId, long messageId, String bearerToken) {
        long caller = requireCaller(bearerToken);
        try (StoreSession s = store.openSession()) {
            s.findConversation(eventId).orElseThrow(() -> ApiException.notFound("Event not found"));
            StoredMessage m = s.findMessage(messageId).orElseThrow(() -> ApiException.notFound("Message not found"));
            if (m.conversationId() != eventId) {
                throw new ApiException(400, "Message does not belong to this event");
            }
            if (m.authorId() != caller) {
                throw new ApiException(403, "You can only delete your own messages");
            }
            s.softDelete(messageId);
        }
        relay.submit(new BroadcastCommand(eventId, null, codec.encode(new OutboundFrame.MessageDeleted(messageId))));
        log.info("user " + caller + " deleted message " + messageId + " in event " + eventId);
    }

    /**
     * Mark the caller as typing in the event and refresh their presence.
     * <p>
     * Order of checks: credential (401), event exists (404), caller is a member (403).
     */
    public void setTyping(long eventId, String bearerToken) {
        long caller = requireCaller(bearerToken);
        try (StoreSession s = store.openSession()) {
            Conversation c = s.findConversation(eventId).orElseThrow(() -> ApiException.notFound("Event not found"));
            if (!c.isMember(caller)) {
                throw new ApiException(403, "You must be attending this event");
            }
        }
        loop.call(() -> {
            hub.setTyping(eventId, caller);
            hub.touchPresence(caller);
            return null;
        }, LOOP_TIMEOUT);
    }

    /**
     * Users typing in the event right now, without the caller.
     * The credential is optional; an anonymous caller sees everyone.
     */
    public TypingUsersResponse typingUsers(long eventId, String bearerToken) {
        Long caller = optionalCaller(bearerToken);
        try (StoreSession s = store.openSession()) {
            s.findConversation(eventId).orElseThrow(() -> ApiException.notFound("Event not found"));
            List<Long> ids = loop.call(() -> hub.listTyping(eventId, hub.now(), caller), LOOP_TIMEOUT);

            var dto = new TypingUsersResponse();
            for (Long id : ids) {
                Optional<UserProfile> user = s.findUser(id);
                if (user.isEmpty()) continue;
                var t = new TypingUsersResponse.TypingUser();
                t.id = id;
                t.name = user.get().displayName();
                t.photoUrl = user.get().photoUrl();
                dto.typingUsers.add(t);
            }
            return dto;
        }
    }

    /**
     * Online flag for every participant of the event plus its owner.
     * A caller who is a member counts as seen now.
     */
    public PresenceResponse presence(long eventId, String bearerToken) {
        Long caller = optionalCaller(bearerToken);
        try (StoreSession s = store.openSession()) {
            Conversation c = s.findConversation(eventId).orElseThrow(() -> ApiException.notFound("Event not found"));
            List<Long> members = new ArrayList<>(c.members());
            members.sort(null);

            Map<Long, Boolean> online = loop.call(() -> {
                if (caller != null && c.isMember(caller)) {
                    hub.touchPresence(caller);
                }
                Instant now = hub.now();
                Map<Long, Boolean> flags = new HashMap<>();
                for (Long id : members) flags.put(id, hub.isOnline(id, now));
                return flags;
            }, LOOP_TIMEOUT);

            var dto = new PresenceResponse();
            for (Long id : members) {
                if (s.findUser(id).isEmpty()) continue;
                var e = new PresenceResponse.Entry();
                e.userId = id;
                e.online = online.get(id);
                dto.presence.add(e);
            }
            return dto;
        }
    }

    // ---------- helpers ----------

    private long requireCaller(String bearerToken) {
        try {
            return verifier.verify(bearerToken);
        } catch (AuthenticationException e) {
            throw new ApiException(401, e.getMessage());
        }
    }

    private Long optionalCaller(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) return null;
        return requireCaller(bearerToken);
    }
}
