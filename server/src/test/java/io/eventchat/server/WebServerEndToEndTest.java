package io.eventchat.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.eventchat.core.SynchronizerRegistry;
import io.eventchat.server.hub.ConnectionHub;
import io.eventchat.server.loop.ChatEventLoop;
import io.eventchat.server.protocol.FrameCodec;
import io.eventchat.server.relay.BroadcastRelay;
import io.eventchat.server.session.ChatContext;
import io.eventchat.storage.Conversation;
import io.eventchat.storage.InMemoryChatStore;
import io.eventchat.storage.StoredMessage;
import io.eventchat.storage.UserProfile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks over a real Undertow listener.
 *
 * Focus:
 *  - Health endpoint and unknown routes.
 *  - WebSocket join: initial_messages, user_joined.
 *  - Posting echoes new_message to every participant.
 *  - REST delete is relayed as message_deleted.
 *  - Bad credentials close the socket with 4401.
 */
class WebServerEndToEndTest {

    private static final int PORT = 18080; // test-only port
    private static final long EVENT = 10;

    private WebServer server;
    private ChatEventLoop loop;
    private BroadcastRelay relay;
    private HttpClient client;
    private FrameCodec codec;

    @BeforeEach
    void startServer() {
        Clock clock = Clock.systemUTC();
        InMemoryChatStore store = new InMemoryChatStore(clock);
        store.addUser(new UserProfile(1, "Olga", "olga@example.com", null, true));
        store.addUser(new UserProfile(2, "Bob", "bob@example.com", null, false));
        store.addUser(new UserProfile(3, "Cy", "cy@example.com", null, false));
        store.addConversation(new Conversation(EVENT, 1, Set.of(2L, 3L), null));
        store.addMessage(new StoredMessage(1, EVENT, 1, "welcome", Instant.parse("2024-05-01T12:00:00Z"), false));

        codec = new FrameCodec();
        var hub = new ConnectionHub(clock);
        var verifier = new StaticVerifier();
        loop = new ChatEventLoop();
        relay = new BroadcastRelay(hub, loop);
        relay.start();

        var ctx = new ChatContext(store, hub, new SynchronizerRegistry(), verifier, codec, ChatContext.DEFAULT_HISTORY_LIMIT);
        var chat = new ChatService(store, verifier, hub, loop, relay, codec);
        server = new WebServer("127.0.0.1", PORT, ctx, loop, chat);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
        relay.close();
        loop.close();
    }

    /** Collects complete text frames and the close code of one client socket. */
    private static final class Frames implements WebSocket.Listener {
        final BlockingQueue<String> texts = new LinkedBlockingQueue<>();
        final CompletableFuture<Integer> closed = new CompletableFuture<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                texts.add(partial.toString());
                partial.setLength(0);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            closed.complete(statusCode);
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            closed.completeExceptionally(error);
        }
    }

    private WebSocket connect(String token, Frames frames) throws Exception {
        URI uri = URI.create("ws://127.0.0.1:" + PORT + "/events/" + EVENT + "/ws?token=" + token);
        return client.newWebSocketBuilder().buildAsync(uri, frames).get(2, TimeUnit.SECONDS);
    }

    private JsonNode next(Frames frames) throws Exception {
        String text = frames.texts.poll(2, TimeUnit.SECONDS);
        assertNotNull(text, "expected a frame");
        return codec.mapper().readTree(text);
    }

    private HttpResponse<String> http(HttpRequest.Builder req) throws Exception {
        return client.send(req.timeout(Duration.ofSeconds(2)).build(), HttpResponse.BodyHandlers.ofString());
    }

    private static URI url(String path) {
        return URI.create("http://127.0.0.1:" + PORT + path);
    }

    @Test
    void health_and_unknown_routes() throws Exception {
        var health = http(HttpRequest.newBuilder(url("/admin/health")).GET());
        assertEquals(200, health.statusCode());
        assertTrue(health.body().contains("\"ok\""));

        var missing = http(HttpRequest.newBuilder(url("/nope")).GET());
        assertEquals(404, missing.statusCode());

        var wrongMethod = http(HttpRequest.newBuilder(url("/events/10/typing")).DELETE());
        assertEquals(405, wrongMethod.statusCode());
    }

    @Test
    void chat_round_trip_with_relayed_delete() throws Exception {
        var bobFrames = new Frames();
        WebSocket bob = connect("user-2", bobFrames);
        JsonNode bobSnapshot = next(bobFrames);
        assertEquals("initial_messages", bobSnapshot.get("type").asText());
        assertEquals("welcome", bobSnapshot.get("messages").get(0).get("content").asText());

        var cyFrames = new Frames();
        WebSocket cy = connect("user-3", cyFrames);
        assertEquals("initial_messages", next(cyFrames).get("type").asText());
        JsonNode joined = next(bobFrames);
        assertEquals("user_joined", joined.get("type").asText());
        assertEquals(3, joined.get("user_id").asLong());

        bob.sendText("{\"type\":\"message\",\"content\":\"hello\"}", true).get(2, TimeUnit.SECONDS);
        JsonNode toBob = next(bobFrames);
        JsonNode toCy = next(cyFrames);
        assertEquals("new_message", toCy.get("type").asText());
        assertEquals(toBob, toCy);
        long messageId = toCy.get("message").get("id").asLong();

        var forbidden = http(HttpRequest.newBuilder(url("/events/10/messages/" + messageId))
                .header("Authorization", "Bearer user-3").DELETE());
        assertEquals(403, forbidden.statusCode());

        var deleted = http(HttpRequest.newBuilder(url("/events/10/messages/" + messageId))
                .header("Authorization", "Bearer user-2").DELETE());
        assertEquals(200, deleted.statusCode());
        assertTrue(deleted.body().contains("Message deleted successfully"));

        JsonNode notice = next(cyFrames);
        assertEquals("message_deleted", notice.get("type").asText());
        assertEquals(messageId, notice.get("message_id").asLong());
        assertEquals("message_deleted", next(bobFrames).get("type").asText());

        cy.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(2, TimeUnit.SECONDS);
        JsonNode left = next(bobFrames);
        assertEquals("user_left", left.get("type").asText());
        assertEquals(3, left.get("user_id").asLong());

        bob.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
    }

    @Test
    void presence_endpoint_sees_connected_user() throws Exception {
        var bobFrames = new Frames();
        WebSocket bob = connect("user-2", bobFrames);
        next(bobFrames);

        var resp = http(HttpRequest.newBuilder(url("/events/10/presence")).GET());
        assertEquals(200, resp.statusCode());
        JsonNode presence = codec.mapper().readTree(resp.body()).get("presence");
        assertEquals(3, presence.size());
        assertEquals(2, presence.get(1).get("user_id").asLong());
        assertTrue(presence.get(1).get("is_online").asBoolean());

        bob.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
    }

    @Test
    void posted_typing_shows_up_in_the_typing_list() throws Exception {
        var set = http(HttpRequest.newBuilder(url("/events/10/typing"))
                .header("Authorization", "Bearer user-2").POST(HttpRequest.BodyPublishers.noBody()));
        assertEquals(200, set.statusCode());
        assertEquals("typing", codec.mapper().readTree(set.body()).get("status").asText());

        var anonymous = http(HttpRequest.newBuilder(url("/events/10/typing")).POST(HttpRequest.BodyPublishers.noBody()));
        assertEquals(401, anonymous.statusCode());

        var list = http(HttpRequest.newBuilder(url("/events/10/typing"))
                .header("Authorization", "Bearer user-3").GET());
        JsonNode typers = codec.mapper().readTree(list.body()).get("typing_users");
        assertEquals(1, typers.size());
        assertEquals(2, typers.get(0).get("id").asLong());
    }

    @Test
    void bad_token_closes_socket_with_4401() throws Exception {
        var frames = new Frames();
        connect("forged", frames);

        assertEquals(4401, frames.closed.get(2, TimeUnit.SECONDS).intValue());
        assertTrue(frames.texts.isEmpty());
    }

    @Test
    void outsider_closes_socket_with_4403() throws Exception {
        var frames = new Frames();
        connect("user-77", frames);

        assertEquals(4403, frames.closed.get(2, TimeUnit.SECONDS).intValue());
    }
}
