package io.iamcore.spi;

import io.iamcore.ErrorKind;

/**
 * Observability hook for exporting command counters and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of commands that completed and appended events.
     *
     * @param command the command name, e.g. {@code smtp.add}
     */
    void incrementCommandSucceeded(String command);

    /**
     * Increments the count of commands that failed.
     *
     * @param command the command name
     * @param kind    the failure classification
     */
    void incrementCommandFailed(String command, ErrorKind kind);

    /**
     * Adds to the count of events appended to the log.
     */
    void incrementEventsAppended(int count);

    /**
     * Increments the count of commands rejected because nothing changed.
     */
    default void incrementNoOpSuppressed(String command) {
    }

    /**
     * Records the number of events folded while hydrating one write model.
     */
    default void recordReplayedEvents(int count) {
    }

    /**
     * Records the wall time of one command.
     *
     * @param command    the command name
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordCommandDurationMs(String command, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementCommandSucceeded(String command) {
        }

        @Override
        public void incrementCommandFailed(String command, ErrorKind kind) {
        }

        @Override
        public void incrementEventsAppended(int count) {
        }
    }
}
