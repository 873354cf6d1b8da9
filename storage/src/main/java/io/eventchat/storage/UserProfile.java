package io.eventchat.storage;

/**
 * Public profile fields the chat layer shows next to messages.
 */
public record UserProfile(
        long id,
        String name,
        String email,
        String photoUrl,
        boolean verified
) {
    /** Name if set, otherwise the email address. */
    public String displayName() {
        return name != null && !name.isBlank() ? name : email;
    }
}
