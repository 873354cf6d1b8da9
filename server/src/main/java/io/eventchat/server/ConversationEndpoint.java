// file: src/main/java/io/eventchat/server/ConversationEndpoint.java
package io.eventchat.server;

import io.eventchat.server.hub.UndertowConnection;
import io.eventchat.server.loop.ChatEventLoop;
import io.eventchat.server.session.ChatContext;
import io.eventchat.server.session.ConversationSession;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.xnio.IoUtils;

import java.net.URI;
import java.util.List;
import java.util.logging.Logger;

/**
 * Undertow side of {@code /events/{eventId}/ws?token=...}.
 * <p>
 * Runs on IO threads and does no chat work itself: it creates a
 * {@link ConversationSession} per channel and enqueues open, every text frame
 * and close onto the {@link ChatEventLoop}, in that order.
 */
final class ConversationEndpoint implements WebSocketConnectionCallback {
    private static final Logger log = Logger.getLogger(ConversationEndpoint.class.getName());

    private final ChatContext ctx;
    private final ChatEventLoop loop;

    ConversationEndpoint(ChatContext ctx, ChatEventLoop loop) {
        this.ctx = ctx;
        this.loop = loop;
    }

    @Override
    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String path = URI.create(exchange.getRequestURI()).getPath();
        var ids = Routes.match(Routes.CHAT_SOCKET, path);
        if (ids.isEmpty()) {
            log.warning("websocket upgrade on unexpected path " + path);
            IoUtils.safeClose(channel);
            return;
        }
        long eventId = ids.get()[0];
        String token = first(exchange.getRequestParameters().get("token"));

        var session = new ConversationSession(eventId, token, new UndertowConnection(channel), ctx);

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                String text = message.getData();
                loop.execute(() -> session.onFrame(text));
            }
        });
        channel.addCloseTask(ch -> loop.execute(session::close));

        loop.execute(session::open);
        channel.resumeReceives();
    }

    private static String first(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
