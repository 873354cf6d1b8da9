// file: client/src/main/java/io/eventchat/client/Cli.java
package io.eventchat.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Simple CLI for talking to a running event chat server.
 *
 * Usage:
 *   eventchat-cli [--base-url http://host:port] [--token T] listen   <eventId>
 *   eventchat-cli [--base-url http://host:port] [--token T] send     <eventId> <text>
 *   eventchat-cli [--base-url http://host:port] [--token T] delete   <eventId> <messageId>
 *   eventchat-cli [--base-url http://host:port] [--token T] typing   <eventId>
 *   eventchat-cli [--base-url http://host:port] [--token T] typing-set <eventId>
 *   eventchat-cli [--base-url http://host:port] [--token T] presence <eventId>
 *
 * The token defaults to $EVENTCHAT_TOKEN.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final String TOKEN_ENV = "EVENTCHAT_TOKEN";
    private static final Duration WAIT = Duration.ofSeconds(5);

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final String baseUrl;
    private final String token;

    private Cli(String baseUrl, String token) {
        this.http = HttpClient.newBuilder().connectTimeout(WAIT).build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
    }

    public static void main(String[] args) {
        try {
            Options opts = Options.parse(args, System.getenv(TOKEN_ENV));
            String[] rest = opts.rest();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(opts.baseUrl(), opts.token());

            switch (cmd) {
                case "listen" -> {
                    if (rest.length != 2) usageAndExit("listen requires <eventId>");
                    cli.listen(parseId(rest[1], "eventId"));
                }
                case "send" -> {
                    if (rest.length != 3) usageAndExit("send requires <eventId> <text>");
                    cli.send(parseId(rest[1], "eventId"), rest[2]);
                }
                case "delete" -> {
                    if (rest.length != 3) usageAndExit("delete requires <eventId> <messageId>");
                    cli.delete(parseId(rest[1], "eventId"), parseId(rest[2], "messageId"));
                }
                case "typing" -> {
                    if (rest.length != 2) usageAndExit("typing requires <eventId>");
                    cli.get("/events/" + parseId(rest[1], "eventId") + "/typing");
                }
                case "typing-set" -> {
                    if (rest.length != 2) usageAndExit("typing-set requires <eventId>");
                    cli.post("/events/" + parseId(rest[1], "eventId") + "/typing");
                }
                case "presence" -> {
                    if (rest.length != 2) usageAndExit("presence requires <eventId>");
                    cli.get("/events/" + parseId(rest[1], "eventId") + "/presence");
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /** Global options in front of the command. */
    record Options(String baseUrl, String token, String[] rest) {

        static Options parse(String[] args, String tokenFromEnv) {
            String baseUrl = DEFAULT_BASE_URL;
            String token = tokenFromEnv;
            int i = 0;
            while (i < args.length && args[i].startsWith("--")) {
                String flag = args[i];
                if (i + 1 >= args.length) {
                    throw new CliException(flag + " requires a value");
                }
                switch (flag) {
                    case "--base-url" -> baseUrl = args[i + 1];
                    case "--token" -> token = args[i + 1];
                    default -> throw new CliException("unknown option: " + flag);
                }
                i += 2;
            }
            String[] rest = new String[args.length - i];
            System.arraycopy(args, i, rest, 0, rest.length);
            return new Options(baseUrl, token, rest);
        }
    }

    // ---------- commands ----------

    /** Print every frame of the event until the server closes the socket. */
    private void listen(long eventId) throws Exception {
        Frames frames = new Frames();
        openSocket(eventId, frames);
        while (true) {
            String text = frames.texts.poll(200, TimeUnit.MILLISECONDS);
            if (text != null) {
                System.out.println(FramePrinter.describe(json.readTree(text)));
            } else if (frames.closed.isDone()) {
                System.out.println("-- closed: " + frames.closed.get() + " --");
                return;
            }
        }
    }

    /** Join, post one message, wait for its echo and leave. */
    private void send(long eventId, String text) throws Exception {
        Frames frames = new Frames();
        WebSocket ws = openSocket(eventId, frames);
        expect(frames, "initial_messages");

        ObjectNode frame = json.createObjectNode();
        frame.put("type", "message");
        frame.put("content", text);
        ws.sendText(json.writeValueAsString(frame), true).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

        JsonNode reply = expect(frames, "new_message", "error");
        System.out.println(FramePrinter.describe(reply));
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void delete(long eventId, long messageId) throws Exception {
        HttpRequest req = authorized(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/events/" + eventId + "/messages/" + messageId))
                .DELETE())
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("DELETE failed (" + resp.statusCode() + "): " + errorOf(resp.body()));
        }
        System.out.println("OK");
    }

    private void get(String path) throws Exception {
        HttpRequest req = authorized(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .GET())
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("GET failed (" + resp.statusCode() + "): " + errorOf(resp.body()));
        }
        System.out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(json.readTree(resp.body())));
    }

    private void post(String path) throws Exception {
        HttpRequest req = authorized(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .POST(HttpRequest.BodyPublishers.noBody()))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("POST failed (" + resp.statusCode() + "): " + errorOf(resp.body()));
        }
        System.out.println(json.readTree(resp.body()).path("status").asText("OK"));
    }

    // ---------- websocket plumbing ----------

    private WebSocket openSocket(long eventId, Frames frames) throws Exception {
        if (token == null || token.isBlank()) {
            throw new CliException("a token is required (--token or $" + TOKEN_ENV + ")");
        }
        String wsBase = baseUrl.replaceFirst("^http", "ws");
        URI uri = URI.create(wsBase + "/events/" + eventId + "/ws?token="
                + URLEncoder.encode(token, StandardCharsets.UTF_8));
        return http.newWebSocketBuilder().buildAsync(uri, frames).get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Skip frames until one of {@code types} arrives; fail on close or timeout. */
    private JsonNode expect(Frames frames, String... types) throws Exception {
        long deadline = System.nanoTime() + WAIT.toNanos();
        List<String> wanted = List.of(types);
        List<String> skipped = new ArrayList<>();
        while (System.nanoTime() < deadline) {
            String text = frames.texts.poll(100, TimeUnit.MILLISECONDS);
            if (text == null) {
                if (frames.closed.isDone()) {
                    throw new CliException("server closed the connection: " + frames.closed.get());
                }
                continue;
            }
            JsonNode frame = json.readTree(text);
            String type = frame.path("type").asText();
            if (wanted.contains(type)) return frame;
            skipped.add(type);
        }
        throw new CliException("no " + wanted + " frame within " + WAIT.toSeconds() + "s (saw " + skipped + ")");
    }

    private static final class Frames implements WebSocket.Listener {
        final BlockingQueue<String> texts = new LinkedBlockingQueue<>();
        final CompletableFuture<String> closed = new CompletableFuture<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                texts.add(partial.toString());
                partial.setLength(0);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            closed.complete(statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason));
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            closed.complete("error " + error.getMessage());
        }
    }

    // ---------- helpers ----------

    private HttpRequest.Builder authorized(HttpRequest.Builder b) {
        if (token != null && !token.isBlank()) {
            b.header("Authorization", "Bearer " + token);
        }
        return b;
    }

    private String errorOf(String body) {
        try {
            JsonNode node = json.readTree(body);
            return node.path("error").asText(body);
        } catch (Exception e) {
            return body;
        }
    }

    private static long parseId(String value, String name) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new CliException(name + " must be a number, got '" + value + "'");
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  eventchat-cli [--base-url http://host:port] [--token T] listen   <eventId>
                  eventchat-cli [--base-url http://host:port] [--token T] send     <eventId> <text>
                  eventchat-cli [--base-url http://host:port] [--token T] delete   <eventId> <messageId>
                  eventchat-cli [--base-url http://host:port] [--token T] typing   <eventId>
                  eventchat-cli [--base-url http://host:port] [--token T] typing-set <eventId>
                  eventchat-cli [--base-url http://host:port] [--token T] presence <eventId>

                The token defaults to $EVENTCHAT_TOKEN.
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
