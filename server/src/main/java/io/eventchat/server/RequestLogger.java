// file: src/main/java/io/eventchat/server/RequestLogger.java
package io.eventchat.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for per-request and per-frame log lines.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method (GET, DELETE, etc.)
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param storeMillis optional store latency, or -1 if not measured
     * @param error       optional exception (for 5xx logging), null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long storeMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                storeMillis >= 0 ? ", store=" + storeMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    /**
     * Log one processed WebSocket frame.
     *
     * @param frameType inbound tag, or "invalid" when decoding failed
     * @param outcome   short result such as "broadcast", "ignored", "rejected"
     * @param error     set when processing failed; logged at WARNING
     */
    public static void logFrame(String frameType, long conversationId, Long participantId, String outcome, Throwable error) {
        String msg = String.format("WS %s event=%d user=%s -> %s", frameType, conversationId, participantId, outcome);
        if (error != null) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.FINE, msg);
        }
    }
}
