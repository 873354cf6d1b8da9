package io.eventchat.core;

import java.util.Locale;

/** Kind of chat a synchronizer belongs to. Ids are only unique within a kind. */
public enum ConversationKind {
    EVENT, GROUP;

    /** Lower-case name used in keys and log lines, e.g. "event". */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
