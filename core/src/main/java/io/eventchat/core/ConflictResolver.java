// file: src/main/java/io/eventchat/core/ConflictResolver.java
package io.eventchat.core;

/**
 * Policy for choosing one of two versions of the same message whose scalar
 * {@code version} is equal but whose payload differs (a concurrent edit).
 * <p>
 * The loser is discarded. Implementations must be deterministic and must not
 * depend on arrival order: choose(a, b) and choose(b, a) return the same version
 * whenever a and b differ in any field the policy looks at.
 */
public interface ConflictResolver {

    MessageVersion choose(MessageVersion existing, MessageVersion incoming);

    /**
     * Last-writer-wins on {@code createdAt}; on an exact timestamp tie the
     * numerically larger authorId wins.
     * <p>
     * This is wall-clock based and does not respect causality. When timestamp
     * and author are both equal, the lexicographically larger content wins so
     * the outcome still does not depend on which frame arrived first.
     */
    final class LastWriterWins implements ConflictResolver {
        @Override
        public MessageVersion choose(MessageVersion existing, MessageVersion incoming) {
            int byTime = incoming.createdAt().compareTo(existing.createdAt());
            if (byTime > 0) return incoming;
            if (byTime < 0) return existing;
            if (incoming.authorId() != existing.authorId()) {
                return incoming.authorId() > existing.authorId() ? incoming : existing;
            }
            return incoming.content().compareTo(existing.content()) > 0 ? incoming : existing;
        }
    }
}
