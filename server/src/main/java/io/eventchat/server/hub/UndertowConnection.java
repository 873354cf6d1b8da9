// file: src/main/java/io/eventchat/server/hub/UndertowConnection.java
package io.eventchat.server.hub;

import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.xnio.IoUtils;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Connection} over an Undertow {@link WebSocketChannel}.
 */
public final class UndertowConnection implements Connection {
    private static final Logger log = Logger.getLogger(UndertowConnection.class.getName());

    private final WebSocketChannel channel;

    public UndertowConnection(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public void send(String payload) throws IOException {
        if (!channel.isOpen()) {
            throw new IOException("channel closed: " + channel.getPeerAddress());
        }
        WebSockets.sendTextBlocking(payload, channel);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameReceived();
    }

    @Override
    public void close(int code, String reason) {
        if (!channel.isOpen()) return;
        try {
            WebSockets.sendCloseBlocking(new CloseMessage(code, reason), channel);
        } catch (IOException e) {
            log.log(Level.FINE, "close frame not delivered to " + channel.getPeerAddress(), e);
        } finally {
            IoUtils.safeClose(channel);
        }
    }

    @Override
    public String toString() {
        return "ws:" + channel.getPeerAddress();
    }
}
