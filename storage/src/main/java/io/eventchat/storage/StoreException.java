package io.eventchat.storage;

/**
 * A store call failed. Callers handling a single chat frame treat this as
 * recoverable; the connection stays open.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
