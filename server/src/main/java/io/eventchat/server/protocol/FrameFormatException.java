package io.eventchat.server.protocol;

/**
 * An inbound frame could not be turned into an {@link InboundFrame}: bad JSON,
 * missing or unknown {@code type}, wrong field types, or message content out of range.
 * Recoverable: the frame is dropped and the connection stays open.
 */
public class FrameFormatException extends IllegalArgumentException {
    public FrameFormatException(String message) {
        super(message);
    }

    public FrameFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
