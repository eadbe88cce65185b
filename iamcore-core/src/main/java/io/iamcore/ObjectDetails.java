package io.iamcore;

import java.time.Instant;

/**
 * Proof of a successful write, returned by every command.
 *
 * <p>The sequence doubles as an optimistic-concurrency token for subsequent reads; protocol
 * adapters render it via {@link #version()}.
 *
 * @param id            the aggregate id
 * @param sequence      the aggregate head after the write
 * @param eventDate     the creation time of the last event folded
 * @param creationDate  the creation time of the aggregate's first event, {@code null} if unknown
 * @param resourceOwner the owning organization or instance
 */
public record ObjectDetails(
        String id,
        long sequence,
        Instant eventDate,
        Instant creationDate,
        String resourceOwner) {

    /**
     * Returns the sequence as a decimal string.
     */
    public String version() {
        return Long.toString(sequence);
    }
}
