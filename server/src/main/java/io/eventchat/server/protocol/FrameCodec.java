// file: src/main/java/io/eventchat/server/protocol/FrameCodec.java
package io.eventchat.server.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.eventchat.core.MessageVersion;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * JSON codec for conversation frames.
 * <p>
 * Responsibilities:
 *  - Decode a text frame into exactly one {@link InboundFrame}, rejecting unknown
 *    tags and malformed fields with {@link FrameFormatException}.
 *  - Encode an {@link OutboundFrame} as {@code {"type": ..., <fields>}} with
 *    snake_case names and ISO-8601 timestamps.
 * <p>
 * Thread safe; one instance is shared by every session.
 */
public final class FrameCodec {

    private final ObjectMapper json;

    public FrameCodec() {
        this(newMapper());
    }

    public FrameCodec(ObjectMapper json) {
        this.json = json;
    }

    /** Mapper used for frames and REST bodies: snake_case, ISO timestamps. */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public ObjectMapper mapper() {
        return json;
    }

    // ---------- inbound ----------

    public InboundFrame decode(String text) {
        JsonNode root;
        try {
            root = json.readTree(text);
        } catch (JsonProcessingException e) {
            throw new FrameFormatException("frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new FrameFormatException("frame must be a JSON object");
        }
        JsonNode type = root.get("type");
        if (type == null || !type.isTextual()) {
            throw new FrameFormatException("frame has no type");
        }

        return switch (type.asText()) {
            case "message" -> new InboundFrame.PostMessage(requireText(root, "content").trim());
            case "sync_message" -> new InboundFrame.SyncMessage(decodeVersion(root.get("message")));
            case "typing" -> new InboundFrame.Typing();
            case "presence_ping" -> new InboundFrame.PresencePing();
            case "mark_read" -> new InboundFrame.MarkRead(requireLong(root, "message_id"));
            default -> throw new FrameFormatException("unknown frame type: " + type.asText());
        };
    }

    /** {@code {id, vector_clock, content, user_id, created_at}} to a MessageVersion. */
    MessageVersion decodeVersion(JsonNode msg) {
        if (msg == null || !msg.isObject()) {
            throw new FrameFormatException("sync_message needs a message object");
        }
        long id = requireLong(msg, "id");
        long userId = requireLong(msg, "user_id");
        JsonNode contentNode = msg.get("content");
        String content = contentNode == null || contentNode.isNull() ? "" : contentNode.asText();
        Instant createdAt = parseTimestamp(requireText(msg, "created_at"));

        Map<Long, Integer> clock = new HashMap<>();
        JsonNode vc = msg.get("vector_clock");
        if (vc != null && !vc.isNull()) {
            if (!vc.isObject()) throw new FrameFormatException("vector_clock must be an object");
            Iterator<Map.Entry<String, JsonNode>> it = vc.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                long author;
                try {
                    author = Long.parseLong(e.getKey());
                } catch (NumberFormatException nfe) {
                    throw new FrameFormatException("vector_clock key is not a user id: " + e.getKey(), nfe);
                }
                if (!e.getValue().canConvertToInt() || e.getValue().asInt() < 0) {
                    throw new FrameFormatException("vector_clock counter for " + author + " must be a non-negative int");
                }
                clock.put(author, e.getValue().asInt());
            }
        }
        return new MessageVersion(id, clock, content, userId, createdAt);
    }

    /**
     * ISO-8601 with offset ("2024-05-01T12:00:00Z", "...+02:00"), or without one,
     * in which case the time is taken as UTC.
     */
    static Instant parseTimestamp(String s) {
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException withOffset) {
            try {
                return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new FrameFormatException("bad timestamp: " + s, e);
            }
        }
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new FrameFormatException(field + " must be a string");
        }
        return v.asText();
    }

    private static long requireLong(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.canConvertToLong() || !v.isIntegralNumber()) {
            throw new FrameFormatException(field + " must be an integer");
        }
        return v.asLong();
    }

    // ---------- outbound ----------

    public String encode(OutboundFrame frame) {
        ObjectNode out = json.createObjectNode();
        out.put("type", frame.type());
        out.setAll((ObjectNode) json.valueToTree(frame));
        try {
            return json.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + frame.type() + " frame", e);
        }
    }
}
