// file: src/main/java/io/eventchat/server/ServerConfig.java
package io.eventchat.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:               HTTP + WebSocket listener port
 *  - bind:                   listener address
 *  - jwtSecret:              HS256 secret for bearer tokens (at least 32 bytes)
 *  - fixturesPath:           optional JSON file seeding the in-memory store
 *  - historyLimit:           messages replayed to a joining client
 *  - presenceTimeoutSeconds: how long a participant counts as online after last activity
 *  - typingTimeoutSeconds:   how long a typing signal stays visible
 */
public record ServerConfig(
        int httpPort,
        String bind,
        String jwtSecret,
        String fixturesPath,
        int historyLimit,
        long presenceTimeoutSeconds,
        long typingTimeoutSeconds
) {
    public static final String JWT_SECRET_ENV = "EVENTCHAT_JWT_SECRET";

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --bind            <address>
     *   --jwt-secret      <secret>   (default: $EVENTCHAT_JWT_SECRET)
     *   --fixtures,  -f   <path>
     *   --history-limit   <n>
     *   --presence-timeout-seconds <seconds>
     *   --typing-timeout-seconds   <seconds>
     *   --help,      -h
     */
    public static ServerConfig fromArgs(String[] args) {
        return fromArgs(args, System.getenv(JWT_SECRET_ENV));
    }

    static ServerConfig fromArgs(String[] args, String secretFromEnv) {
        // Defaults
        int httpPort = 8080;
        String bind = "0.0.0.0";
        String jwtSecret = secretFromEnv;
        String fixtures = null;
        int historyLimit = 50;
        long presenceTimeoutSeconds = 300;
        long typingTimeoutSeconds = 3;

        // CLIArg Parser
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args[++i], "http-port");
                }

                case "--bind" -> {
                    ensureValue(args, i);
                    bind = args[++i];
                }

                case "--jwt-secret" -> {
                    ensureValue(args, i);
                    jwtSecret = args[++i];
                }

                case "--fixtures", "-f" -> {
                    ensureValue(args, i);
                    fixtures = args[++i];
                }

                case "--history-limit" -> {
                    ensureValue(args, i);
                    historyLimit = parseInt(args[++i], "history-limit");
                }

                case "--presence-timeout-seconds" -> {
                    ensureValue(args, i);
                    presenceTimeoutSeconds = parseInt(args[++i], "presence-timeout-seconds");
                }

                case "--typing-timeout-seconds" -> {
                    ensureValue(args, i);
                    typingTimeoutSeconds = parseInt(args[++i], "typing-timeout-seconds");
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        if (jwtSecret == null || jwtSecret.isBlank()) {
            System.err.println("Missing --jwt-secret (or " + JWT_SECRET_ENV + ")");
            System.exit(1);
        }
        return new ServerConfig(
                httpPort,
                bind,
                jwtSecret,
                fixtures,
                historyLimit,
                presenceTimeoutSeconds,
                typingTimeoutSeconds
        );
    }

    public ServerConfig {
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("port out of range");
        if (historyLimit <= 0) throw new IllegalArgumentException("history-limit must be > 0");
        if (presenceTimeoutSeconds <= 0 || typingTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeouts must be > 0");
        }
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + option + ": " + value);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: eventchat-server [options]

            Options:
              --http-port,      -p   HTTP/WebSocket port (default: 8080)
              --bind                 Listen address (default: 0.0.0.0)
              --jwt-secret           HS256 token secret, >= 32 bytes (default: $EVENTCHAT_JWT_SECRET)
              --fixtures,       -f   JSON file seeding the in-memory store (optional)
              --history-limit        Messages replayed on join (default: 50)
              --presence-timeout-seconds  Online window after last activity (default: 300)
              --typing-timeout-seconds    Typing indicator lifetime (default: 3)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
