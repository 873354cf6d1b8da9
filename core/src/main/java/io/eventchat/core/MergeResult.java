package io.eventchat.core;

import java.util.Objects;

/**
 * Outcome of {@link MessageSynchronizer#merge(MessageVersion)}.
 *
 * @param isNew   true when the stored state changed or a conflict was resolved
 *                and the winner should be fanned out; false for duplicates and stale input
 * @param version the version stored for the message id after the merge
 */
public record MergeResult(boolean isNew, MessageVersion version) {

    public MergeResult {
        Objects.requireNonNull(version, "version");
    }

    static MergeResult accepted(MessageVersion v) {
        return new MergeResult(true, v);
    }

    static MergeResult ignored(MessageVersion existing) {
        return new MergeResult(false, existing);
    }
}
