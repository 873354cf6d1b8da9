package io.eventchat.server.session;

/**
 * Lifecycle of one conversation connection. Transitions only move forward.
 */
public enum SessionState {
    CONNECTING,
    AUTHENTICATING,
    AUTHORIZING,
    REPLAYING,
    OPEN,
    CLOSING,
    CLOSED
}
