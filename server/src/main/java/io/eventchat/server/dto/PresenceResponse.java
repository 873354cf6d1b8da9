package io.eventchat.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** Body of GET /events/{eventId}/presence. */
public class PresenceResponse {
    public static class Entry {
        public long userId;
        @JsonProperty("is_online")
        public boolean online;
    }

    public List<Entry> presence = new ArrayList<>();
}
