package io.eventchat.server.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.eventchat.storage.UserProfile;

/**
 * Author block attached to every message on the wire.
 */
public record UserView(
        long id,
        String name,
        String email,
        String photoUrl,
        @JsonProperty("is_verified") boolean isVerified
) {
    public static UserView of(UserProfile p) {
        return new UserView(p.id(), p.displayName(), p.email(), p.photoUrl(), p.verified());
    }

    /** Placeholder for an author the store no longer knows. */
    public static UserView unknown(long id) {
        return new UserView(id, "Unknown", "", null, false);
    }
}
