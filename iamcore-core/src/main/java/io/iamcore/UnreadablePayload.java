package io.iamcore;

/**
 * Payload of an {@link UnreadableEventType} event.
 *
 * @param data   the stored payload, unchanged
 * @param reason why the event could not be read
 */
public record UnreadablePayload(String data, String reason) implements EventPayload {
}
