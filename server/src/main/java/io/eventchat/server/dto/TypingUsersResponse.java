package io.eventchat.server.dto;

import java.util.ArrayList;
import java.util.List;

/** Body of GET /events/{eventId}/typing. */
public class TypingUsersResponse {
    public static class TypingUser {
        public long id;
        public String name;
        public String photoUrl;
    }

    public List<TypingUser> typingUsers = new ArrayList<>();
}
