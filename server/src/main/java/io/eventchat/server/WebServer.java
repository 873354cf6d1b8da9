// file: src/main/java/io/eventchat/server/WebServer.java
package io.eventchat.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventchat.server.loop.ChatEventLoop;
import io.eventchat.server.session.ChatContext;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Thin HTTP + WebSocket adapter over the chat loop and {@link ChatService}.
 *
 * Responsibilities:
 *  - Route by method + path.
 *  - Upgrade chat connections and hand them to {@link ConversationEndpoint}.
 *  - Convert service results into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET    /events/{eventId}/ws?token=T                  WebSocket chat channel
 *   - DELETE /events/{eventId}/messages/{messageId}        Author-only soft delete
 *   - GET    /events/{eventId}/typing                      Who is typing now
 *   - POST   /events/{eventId}/typing                      Mark the caller as typing
 *   - GET    /events/{eventId}/presence                    Online flag per member
 *   - GET    /admin/health                                 Basic health check
 *
 * REST calls authenticate with {@code Authorization: Bearer <token>}.
 */
public final class WebServer {

    private final Undertow server;
    private final ObjectMapper json;
    private final ChatService chat;
    private final HttpHandler websocket;

    public WebServer(String bind, int port, ChatContext ctx, ChatEventLoop loop, ChatService chat) {
        this.chat = chat;
        this.json = ctx.codec().mapper();
        this.websocket = Handlers.websocket(new ConversationEndpoint(ctx, loop));

        this.server = Undertow.builder()
                .addHttpListener(port, bind)
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();

                    if (Routes.CHAT_SOCKET.matcher(path).matches() && "GET".equals(method)) {
                        websocket.handleRequest(exchange);
                        RequestLogger.logRequest(method, path, exchange.getStatusCode(), 0, -1, null);
                        return;
                    }
                    if (exchange.isInIoThread()) {
                        // handlers below wait on the store and the chat loop
                        exchange.dispatch(this::route);
                        return;
                    }
                    route(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        var path = ex.getRequestPath();
        var method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        var message = Routes.match(Routes.MESSAGE, path);
        var typing = Routes.match(Routes.TYPING, path);
        var presence = Routes.match(Routes.PRESENCE, path);

        if (message.isPresent()) {
            if ("DELETE".equals(method)) {
                long[] ids = message.get();
                handle(ex, () -> {
                    chat.deleteMessage(ids[0], ids[1], bearerToken(ex));
                    return Map.of("message", "Message deleted successfully");
                });
            } else {
                methodNotAllowed(ex, method, path);
            }
        } else if (typing.isPresent()) {
            if ("GET".equals(method)) {
                handle(ex, () -> chat.typingUsers(typing.get()[0], bearerToken(ex)));
            } else if ("POST".equals(method)) {
                long eventId = typing.get()[0];
                handle(ex, () -> {
                    chat.setTyping(eventId, bearerToken(ex));
                    return Map.of("status", "typing");
                });
            } else {
                methodNotAllowed(ex, method, path);
            }
        } else if (presence.isPresent()) {
            if ("GET".equals(method)) {
                handle(ex, () -> chat.presence(presence.get()[0], bearerToken(ex)));
            } else {
                methodNotAllowed(ex, method, path);
            }
        } else if ("/admin/health".equals(path)) {
            send(ex, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, 200, 0, -1, null);
        } else {
            send(ex, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, path, 404, 0, -1, null);
        }
    }

    private interface Action {
        Object run();
    }

    /** Run a service call and map its outcome to a status code and JSON body. */
    private void handle(HttpServerExchange ex, Action action) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            Object body = action.run();
            send(ex, status, body);
        } catch (ApiException api) {
            status = api.status();
            error = api;
            send(ex, status, Map.of("error", api.getMessage()));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, totalMs, -1, error);
        }
    }

    private void methodNotAllowed(HttpServerExchange ex, String method, String path) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, path, 405, 0, -1, null);
    }

    // ---------- helpers ----------

    /** Token from {@code Authorization: Bearer <token>}, or null. */
    static String bearerToken(HttpServerExchange ex) {
        String header = ex.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header == null) return null;
        String prefix = "Bearer ";
        if (header.length() <= prefix.length() || !header.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return null;
        }
        return header.substring(prefix.length()).trim();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
