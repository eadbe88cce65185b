package io.iamcore;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable, sequenced fact about one aggregate, as stored in the log.
 *
 * @param eventId    unique event identifier
 * @param aggregate  the aggregate stream the event belongs to
 * @param sequence   per-aggregate sequence, starting at 1
 * @param type       the event type
 * @param payload    the typed payload
 * @param editorUser the acting user, may be {@code null} for system events
 * @param createdAt  the time the log accepted the event
 */
public record Event(
        String eventId,
        AggregateRef aggregate,
        long sequence,
        EventType type,
        EventPayload payload,
        String editorUser,
        Instant createdAt) {

    public Event {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(aggregate, "aggregate");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
    }

    /**
     * Returns the payload cast to the expected type.
     *
     * @throws IllegalStateException if the payload is of a different type
     */
    public <P extends EventPayload> P payload(Class<P> payloadType) {
        if (!payloadType.isInstance(payload)) {
            throw new IllegalStateException("Event " + eventId + " of type " + type.name()
                    + " carries " + payload.getClass().getName() + ", not " + payloadType.getName());
        }
        return payloadType.cast(payload);
    }
}
