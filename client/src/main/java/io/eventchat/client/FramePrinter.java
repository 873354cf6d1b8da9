// file: client/src/main/java/io/eventchat/client/FramePrinter.java
package io.eventchat.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One-line, human readable rendering of server frames for the CLI.
 * Unknown frame types fall back to the raw JSON.
 */
final class FramePrinter {

    private FramePrinter() {
    }

    static String describe(JsonNode frame) {
        String type = frame.path("type").asText("");
        return switch (type) {
            case "initial_messages" -> {
                JsonNode messages = frame.path("messages");
                StringBuilder sb = new StringBuilder("-- " + messages.size() + " message(s) in history --");
                for (JsonNode m : messages) {
                    sb.append(System.lineSeparator()).append(message(m));
                }
                yield sb.toString();
            }
            case "new_message" -> message(frame.path("message"));
            case "user_joined" -> "* " + frame.path("user_name").asText() + " joined";
            case "user_left" -> "* user " + frame.path("user_id").asLong() + " left";
            case "typing" -> "* " + frame.path("user_name").asText() + " is typing";
            case "presence_update" -> "* online: " + frame.path("online_users");
            case "message_read" -> "* user " + frame.path("user_id").asLong()
                    + " read #" + frame.path("message_id").asLong();
            case "message_deleted" -> "* message #" + frame.path("message_id").asLong() + " deleted";
            case "error" -> "! " + frame.path("message").asText();
            default -> frame.toString();
        };
    }

    private static String message(JsonNode m) {
        String author = m.path("user").path("name").asText("?");
        String body = m.path("is_deleted").asBoolean(false) ? "(deleted)" : m.path("content").asText();
        return "[#" + m.path("id").asLong() + " v" + m.path("version").asInt() + "] " + author + ": " + body;
    }
}
