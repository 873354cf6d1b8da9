package io.eventchat.server.session;

import io.eventchat.core.SynchronizerRegistry;
import io.eventchat.server.auth.CredentialVerifier;
import io.eventchat.server.hub.ConnectionHub;
import io.eventchat.server.protocol.FrameCodec;
import io.eventchat.storage.ChatStore;

import java.util.Objects;

/**
 * Process-wide collaborators shared by every {@link ConversationSession}.
 * Hub and registry are only touched from the chat loop.
 *
 * @param historyLimit how many recent messages are replayed on connect
 */
public record ChatContext(
        ChatStore store,
        ConnectionHub hub,
        SynchronizerRegistry registry,
        CredentialVerifier verifier,
        FrameCodec codec,
        int historyLimit
) {
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    public ChatContext {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(hub, "hub");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(verifier, "verifier");
        Objects.requireNonNull(codec, "codec");
        if (historyLimit <= 0) throw new IllegalArgumentException("historyLimit must be > 0");
    }
}
