package io.iamcore.jdbc.store;

import java.time.Instant;

/**
 * One row of the event table, with the payload still in its encoded form.
 */
public record EventRow(
    String eventId,
    String aggregateType,
    String aggregateId,
    String resourceOwner,
    long sequence,
    String eventType,
    String payload,
    String editorUser,
    Instant createdAt) {
}
