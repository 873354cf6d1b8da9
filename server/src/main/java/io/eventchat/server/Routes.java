package io.eventchat.server;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Path patterns served by {@link WebServer}. Ids are decimal longs.
 */
final class Routes {
    static final Pattern CHAT_SOCKET = Pattern.compile("^/events/(\\d{1,18})/ws/?$");
    static final Pattern MESSAGE = Pattern.compile("^/events/(\\d{1,18})/messages/(\\d{1,18})/?$");
    static final Pattern TYPING = Pattern.compile("^/events/(\\d{1,18})/typing/?$");
    static final Pattern PRESENCE = Pattern.compile("^/events/(\\d{1,18})/presence/?$");

    private Routes() {
    }

    /** Matched numeric groups of {@code pattern} against {@code path}, or empty. */
    static Optional<long[]> match(Pattern pattern, String path) {
        Matcher m = pattern.matcher(path);
        if (!m.matches()) return Optional.empty();
        long[] ids = new long[m.groupCount()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = Long.parseLong(m.group(i + 1));
        }
        return Optional.of(ids);
    }
}
