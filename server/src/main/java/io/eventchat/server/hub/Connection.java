package io.eventchat.server.hub;

import java.io.IOException;

/**
 * One live client channel, as seen by the hub and the session.
 * <p>
 * {@link #send} blocks until the frame is written or fails, so a dead peer
 * surfaces as an {@link IOException} on the calling thread.
 */
public interface Connection {

    void send(String payload) throws IOException;

    boolean isOpen();

    /** Close with a WebSocket close code and reason. Never throws. */
    void close(int code, String reason);
}
