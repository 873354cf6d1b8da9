// file: src/main/java/io/eventchat/server/Main.java
package io.eventchat.server;

import io.eventchat.core.SynchronizerRegistry;
import io.eventchat.server.auth.JwtCredentialVerifier;
import io.eventchat.server.hub.ConnectionHub;
import io.eventchat.server.loop.ChatEventLoop;
import io.eventchat.server.protocol.FrameCodec;
import io.eventchat.server.relay.BroadcastRelay;
import io.eventchat.server.session.ChatContext;
import io.eventchat.storage.InMemoryChatStore;
import io.eventchat.storage.StoreFixtures;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.LogManager;

/**
 * Entry point for the event chat server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load logging config and the store (fixtures or empty).
 *  - Wire hub, synchronizer registry, chat loop, broadcast relay and services.
 *  - Start the HTTP/WebSocket listener and stop everything on shutdown.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        loadLoggingConfig();
        var cfg = ServerConfig.fromArgs(args);
        var clock = Clock.systemUTC();

        // ------ Store -------
        InMemoryChatStore store = cfg.fixturesPath() != null
                ? StoreFixtures.fromJsonFile(Path.of(cfg.fixturesPath()), clock)
                : new InMemoryChatStore(clock);

        // ------ Chat state (owned by the loop) -------
        var hub = new ConnectionHub(
                clock,
                Duration.ofSeconds(cfg.presenceTimeoutSeconds()),
                Duration.ofSeconds(cfg.typingTimeoutSeconds())
        );
        var registry = new SynchronizerRegistry();
        var loop = new ChatEventLoop();
        var relay = new BroadcastRelay(hub, loop);
        relay.start();

        var codec = new FrameCodec();
        var verifier = new JwtCredentialVerifier(cfg.jwtSecret());
        var ctx = new ChatContext(store, hub, registry, verifier, codec, cfg.historyLimit());
        var chat = new ChatService(store, verifier, hub, loop, relay, codec);

        // ------ HTTP layer ------
        var web = new WebServer(cfg.bind(), cfg.httpPort(), ctx, loop, chat);
        web.start();

        System.out.printf("Event chat listening on http://%s:%d (ws: /events/{id}/ws)%n", cfg.bind(), cfg.httpPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            relay.close();
            loop.close();
        }, "shutdown"));
    }

    private static void loadLoggingConfig() throws IOException {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
