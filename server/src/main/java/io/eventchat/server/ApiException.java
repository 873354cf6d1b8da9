package io.eventchat.server;

/**
 * A REST call failed with a specific HTTP status; the message goes into the
 * {@code {"error": ...}} body.
 */
public class ApiException extends RuntimeException {
    private final int status;

    public ApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }

    public static ApiException notFound(String message) {
        return new ApiException(404, message);
    }
}
