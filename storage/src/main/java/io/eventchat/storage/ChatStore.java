// file: src/main/java/io/eventchat/storage/ChatStore.java
package io.eventchat.storage;

/**
 * Boundary to the external durable store that owns users, events and messages.
 * <p>
 * A chat connection opens one {@link StoreSession} when it is accepted and
 * releases it when it closes, whatever the reason.
 */
public interface ChatStore {

    StoreSession openSession();
}
