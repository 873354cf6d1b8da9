package io.eventchat.storage;

import java.time.Instant;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One event's chat channel as the store knows it.
 *
 * @param id             event id
 * @param ownerId        organizer; always allowed in, whether or not listed as participant
 * @param participantIds users who joined the event
 * @param endsAt         end of the messaging window, or null if the chat never closes
 */
public record Conversation(
        long id,
        long ownerId,
        Set<Long> participantIds,
        Instant endsAt
) {
    public Conversation {
        participantIds = Set.copyOf(Objects.requireNonNull(participantIds, "participantIds"));
    }

    public boolean isMember(long userId) {
        return userId == ownerId || participantIds.contains(userId);
    }

    /** True once {@code now} has reached the end of the messaging window. */
    public boolean isReadOnlyAt(Instant now) {
        return endsAt != null && !now.isBefore(endsAt);
    }

    /** Participants plus the owner. */
    public Set<Long> members() {
        Set<Long> all = new HashSet<>(participantIds);
        all.add(ownerId);
        return Set.copyOf(all);
    }
}
