// file: src/main/java/io/eventchat/server/session/ConversationSession.java
package io.eventchat.server.session;

import io.eventchat.core.ConversationKey;
import io.eventchat.core.MergeResult;
import io.eventchat.core.MessageSynchronizer;
import io.eventchat.core.MessageVersion;
import io.eventchat.server.RequestLogger;
import io.eventchat.server.auth.AuthenticationException;
import io.eventchat.server.hub.Connection;
import io.eventchat.server.hub.ConnectionHub;
import io.eventchat.server.protocol.FrameFormatException;
import io.eventchat.server.protocol.InboundFrame;
import io.eventchat.server.protocol.MessageView;
import io.eventchat.server.protocol.OutboundFrame;
import io.eventchat.server.protocol.UserView;
import io.eventchat.storage.Conversation;
import io.eventchat.storage.StoreSession;
import io.eventchat.storage.StoredMessage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One client's connection to one conversation.
 * <p>
 * Lifecycle:
 *  1) {@link #open()}: authenticate the token, authorize against the conversation,
 *     register with the hub, replay history as {@code initial_messages}, announce
 *     {@code user_joined}. Failures close the connection (4401 / 4403).
 *  2) {@link #onFrame(String)}: one inbound frame at a time while OPEN. A frame
 *     that fails is logged and dropped; the session keeps going unless the
 *     transport is gone.
 *  3) {@link #close()}: unregister, announce {@code user_left}, release the store
 *     session. Runs at most once whatever path led here.
 * <p>
 * All methods must be called on the chat loop thread.
 */
public final class ConversationSession {
    private static final Logger log = Logger.getLogger(ConversationSession.class.getName());

    public static final int CLOSE_NORMAL = 1000;
    public static final int CLOSE_INTERNAL_ERROR = 1011;
    public static final int CLOSE_AUTHENTICATION_FAILED = 4401;
    public static final int CLOSE_ACCESS_DENIED = 4403;

    private final long conversationId;
    private final String token;
    private final Connection connection;
    private final ChatContext ctx;
    private final ConnectionHub hub;

    private SessionState state = SessionState.CONNECTING;
    private StoreSession store;
    private Long participantId;
    private UserView self;
    private Conversation conversation;
    private MessageSynchronizer sync;
    private boolean registered;

    public ConversationSession(long conversationId, String token, Connection connection, ChatContext ctx) {
        this.conversationId = conversationId;
        this.token = token;
        this.connection = Objects.requireNonNull(connection, "connection");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.hub = ctx.hub();
    }

    public SessionState state() {
        return state;
    }

    /** Authenticated participant, or null before authentication succeeded. */
    public Long participantId() {
        return participantId;
    }

    public long conversationId() {
        return conversationId;
    }

    // ---------- open ----------

    public void open() {
        if (state != SessionState.CONNECTING) {
            throw new IllegalStateException("session already opened, state=" + state);
        }
        state = SessionState.AUTHENTICATING;
        try {
            store = ctx.store().openSession();
            long pid = ctx.verifier().verify(token);
            participantId = pid;

            state = SessionState.AUTHORIZING;
            conversation = store.findConversation(conversationId)
                    .orElseThrow(() -> new AccessDeniedException(AccessDeniedException.NOT_FOUND));
            if (!conversation.isMember(pid)) {
                throw new AccessDeniedException(AccessDeniedException.DENIED);
            }
            self = store.findUser(pid).map(UserView::of).orElseGet(() -> UserView.unknown(pid));

            state = SessionState.REPLAYING;
            hub.register(conversationId, pid, connection);
            registered = true;
            hub.touchPresence(pid);
            sync = ctx.registry().forConversation(ConversationKey.event(conversationId));

            connection.send(encode(new OutboundFrame.InitialMessages(replay())));
            hub.broadcast(conversationId, pid, encode(new OutboundFrame.UserJoined(pid, self.name(), self.photoUrl())));

            state = SessionState.OPEN;
            log.info("user " + pid + " joined event " + conversationId + " via " + connection);
        } catch (AuthenticationException e) {
            log.log(Level.FINE, "authentication failed for event " + conversationId + ": " + e.getMessage());
            reject(CLOSE_AUTHENTICATION_FAILED, e.getMessage());
        } catch (AccessDeniedException e) {
            log.log(Level.FINE, "user " + participantId + " refused on event " + conversationId + ": " + e.getMessage());
            reject(CLOSE_ACCESS_DENIED, e.getMessage());
        } catch (IOException e) {
            log.log(Level.FINE, "connection for event " + conversationId + " went away during replay", e);
            close();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "failed to open session for event " + conversationId, e);
            reject(CLOSE_INTERNAL_ERROR, "Internal error");
        }
    }

    /**
     * Feed recent history through the synchronizer and render its order.
     * Versions whose stored message no longer exists, or belongs to another
     * event, are skipped.
     */
    private List<MessageView> replay() {
        int limit = ctx.historyLimit();
        for (StoredMessage m : store.loadRecentMessages(conversationId, limit)) {
            sync.initializeVersion(m.id(), m.authorId(), m.visibleContent(), m.createdAt());
        }

        Map<Long, UserView> authors = new HashMap<>();
        List<MessageView> views = new ArrayList<>();
        for (MessageVersion v : sync.orderedMessages(limit)) {
            Optional<StoredMessage> stored = store.findMessage(v.messageId())
                    .filter(msg -> msg.conversationId() == conversationId);
            if (stored.isEmpty()) continue;
            StoredMessage m = stored.get();
            UserView author = authors.computeIfAbsent(m.authorId(), this::lookupUser);
            views.add(MessageView.of(v, m.deleted(), store.hasRead(m.id(), participantId), author));
        }
        return views;
    }

    // ---------- frames ----------

    public void onFrame(String text) {
        if (state != SessionState.OPEN) {
            log.log(Level.FINE, () -> "frame ignored for event " + conversationId + " in state " + state);
            return;
        }

        InboundFrame frame;
        try {
            frame = ctx.codec().decode(text);
        } catch (FrameFormatException e) {
            RequestLogger.logFrame("invalid", conversationId, participantId, "rejected: " + e.getMessage(), null);
            return;
        }

        try {
            String outcome = dispatch(frame);
            RequestLogger.logFrame(frame.type(), conversationId, participantId, outcome, null);
        } catch (FrameFormatException e) {
            RequestLogger.logFrame(frame.type(), conversationId, participantId, "rejected: " + e.getMessage(), null);
        } catch (IOException e) {
            log.log(Level.FINE, "connection of user " + participantId + " on event " + conversationId + " lost", e);
            close();
        } catch (RuntimeException e) {
            RequestLogger.logFrame(frame.type(), conversationId, participantId, "failed", e);
            if (!connection.isOpen()) {
                close();
            }
        }
    }

    private String dispatch(InboundFrame frame) throws IOException {
        if (frame instanceof InboundFrame.PostMessage post) return onPost(post);
        if (frame instanceof InboundFrame.SyncMessage syncMessage) return onSync(syncMessage);
        if (frame instanceof InboundFrame.Typing) return onTyping();
        if (frame instanceof InboundFrame.PresencePing) return onPresencePing();
        if (frame instanceof InboundFrame.MarkRead read) return onMarkRead(read);
        throw new FrameFormatException("unhandled frame " + frame.type());
    }

    private String onPost(InboundFrame.PostMessage post) throws IOException {
        if (conversation.isReadOnlyAt(hub.now())) {
            connection.send(encode(new OutboundFrame.ErrorNotice(OutboundFrame.EVENT_ENDED)));
            return "read-only";
        }
        String content = post.requireValidContent();

        StoredMessage m = store.persistMessage(conversationId, participantId, content);
        MessageVersion v = sync.createVersion(m.id(), participantId, m.content(), m.createdAt());
        hub.touchPresence(participantId);

        MessageView view = MessageView.of(v, false, false, self);
        int n = hub.broadcast(conversationId, null, encode(new OutboundFrame.NewMessage(view)));
        return "message " + m.id() + " v" + v.version() + " sent to " + n;
    }

    private String onSync(InboundFrame.SyncMessage frame) {
        MergeResult r = sync.merge(frame.version());
        if (!r.isNew()) {
            return "message " + frame.version().messageId() + " not newer";
        }
        MessageVersion v = r.version();
        boolean deleted = store.findMessage(v.messageId()).map(StoredMessage::deleted).orElse(false);
        MessageView view = MessageView.of(v, deleted, false, lookupUser(v.authorId()));
        int n = hub.broadcast(conversationId, participantId, encode(new OutboundFrame.NewMessage(view)));
        return "message " + v.messageId() + " merged, sent to " + n;
    }

    private String onTyping() {
        hub.setTyping(conversationId, participantId);
        hub.touchPresence(participantId);
        int n = hub.broadcast(conversationId, participantId,
                encode(new OutboundFrame.TypingNotice(participantId, self.name())));
        return "sent to " + n;
    }

    private String onPresencePing() throws IOException {
        hub.touchPresence(participantId);
        List<Long> online = hub.onlineParticipants(conversationId, hub.now(), participantId);
        connection.send(encode(new OutboundFrame.PresenceUpdate(online)));
        return online.size() + " online";
    }

    private String onMarkRead(InboundFrame.MarkRead read) {
        Optional<StoredMessage> m = store.findMessage(read.messageId())
                .filter(msg -> msg.conversationId() == conversationId);
        if (m.isEmpty()) {
            return "unknown message " + read.messageId();
        }
        if (!store.recordReadReceipt(read.messageId(), participantId)) {
            return "already read";
        }
        int n = hub.broadcast(conversationId, participantId,
                encode(new OutboundFrame.MessageRead(read.messageId(), participantId)));
        return "sent to " + n;
    }

    // ---------- close ----------

    private void reject(int code, String reason) {
        state = SessionState.CLOSING;
        connection.close(code, reason);
        close();
    }

    /**
     * Leave the conversation and release the store session. Idempotent.
     */
    public void close() {
        if (state == SessionState.CLOSED) return;
        state = SessionState.CLOSING;
        try {
            if (registered) {
                registered = false;
                if (hub.unregister(conversationId, participantId, connection)) {
                    hub.broadcast(conversationId, participantId, encode(new OutboundFrame.UserLeft(participantId)));
                    log.info("user " + participantId + " left event " + conversationId);
                } else {
                    log.fine("user " + participantId + " already reconnected to event " + conversationId);
                }
            }
        } finally {
            if (store != null) {
                store.close();
            }
            state = SessionState.CLOSED;
        }
    }

    // ---------- helpers ----------

    private UserView lookupUser(long userId) {
        return store.findUser(userId).map(UserView::of).orElseGet(() -> UserView.unknown(userId));
    }

    private String encode(OutboundFrame frame) {
        return ctx.codec().encode(frame);
    }
}
