package io.eventchat.server.session;

/**
 * The conversation does not exist or the caller is neither a participant nor its owner.
 * The message is the close reason sent to the client.
 */
public class AccessDeniedException extends RuntimeException {
    public static final String NOT_FOUND = "Event not found";
    public static final String DENIED = "Access denied";

    public AccessDeniedException(String message) {
        super(message);
    }
}
