// file: src/main/java/io/eventchat/storage/StoreFixtures.java
package io.eventchat.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * JSON seed data for {@link InMemoryChatStore}.
 * <p>
 * Layout:
 * <pre>
 * {
 *   "users":         [{"id": 1, "name": "Ada", "email": "...", "photoUrl": "...", "verified": true}],
 *   "conversations": [{"id": 10, "ownerId": 1, "participantIds": [2, 3], "endsAt": "2030-01-01T00:00:00Z"}],
 *   "messages":      [{"id": 100, "conversationId": 10, "authorId": 2, "content": "hi",
 *                      "createdAt": "2024-05-01T12:00:00Z", "deleted": false}]
 * }
 * </pre>
 */
public final class StoreFixtures {

    public static final class UserJson {
        public long id;
        public String name;
        public String email;
        public String photoUrl;
        public boolean verified;
    }

    public static final class ConversationJson {
        public long id;
        public long ownerId;
        public List<Long> participantIds = new ArrayList<>();
        public Instant endsAt;
    }

    public static final class MessageJson {
        public long id;
        public long conversationId;
        public long authorId;
        public String content;
        public Instant createdAt;
        public boolean deleted;
    }

    public List<UserJson> users = new ArrayList<>();
    public List<ConversationJson> conversations = new ArrayList<>();
    public List<MessageJson> messages = new ArrayList<>();

    public static InMemoryChatStore fromJsonFile(Path path) {
        return fromJsonFile(path, Clock.systemUTC());
    }

    public static InMemoryChatStore fromJsonFile(Path path, Clock clock) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            StoreFixtures fx = mapper.readValue(path.toFile(), StoreFixtures.class);
            return fx.load(new InMemoryChatStore(clock));
        } catch (IOException e) {
            throw new StoreException("Failed to load store fixtures from " + path, e);
        }
    }

    InMemoryChatStore load(InMemoryChatStore store) {
        for (UserJson u : users) {
            store.addUser(new UserProfile(u.id, u.name, u.email, u.photoUrl, u.verified));
        }
        for (ConversationJson c : conversations) {
            store.addConversation(new Conversation(c.id, c.ownerId, new HashSet<>(c.participantIds), c.endsAt));
        }
        for (MessageJson m : messages) {
            if (m.content == null || m.createdAt == null) {
                throw new IllegalArgumentException("message " + m.id + " needs content and createdAt");
            }
            store.addMessage(new StoredMessage(m.id, m.conversationId, m.authorId, m.content, m.createdAt, m.deleted));
        }
        return store;
    }
}
