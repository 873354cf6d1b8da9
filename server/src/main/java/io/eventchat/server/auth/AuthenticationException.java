package io.eventchat.server.auth;

/**
 * Missing or invalid credential. The message is the close reason sent to the client.
 */
public class AuthenticationException extends RuntimeException {
    public static final String REQUIRED = "Authentication required";
    public static final String INVALID = "Invalid authentication";

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
