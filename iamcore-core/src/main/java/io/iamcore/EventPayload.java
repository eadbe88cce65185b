package io.iamcore;

/**
 * Marker for typed event payloads. Implementations are immutable records.
 */
public interface EventPayload {
}
