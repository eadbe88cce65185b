package io.iamcore.spi;

import io.iamcore.CommandContext;
import io.iamcore.Event;
import io.iamcore.PendingEvent;

import java.util.List;

/**
 * Append-only, per-aggregate ordered store of events.
 *
 * <p>Implementations must make {@link #append} atomic: either every event of the batch is
 * stored or none is. Sequences are assigned per aggregate, starting at 1, with no gaps.
 *
 * @see io.iamcore.log.InMemoryEventLog
 */
public interface EventLog {

    /**
     * Appends a batch of events atomically.
     *
     * <p>For every pending event with an expected sequence, the current head of its aggregate
     * must equal that value, otherwise the whole batch is rejected.
     *
     * @param context the invocation context
     * @param events  events to append, in order; may span several aggregates
     * @return the stored events with sequences and timestamps assigned, in the same order
     * @throws io.iamcore.CommandException with {@code CONCURRENCY_CONFLICT} when an expected
     *         sequence does not match, {@code UNAVAILABLE} when the store cannot be reached, or
     *         {@code SERIALIZATION_ERROR} when a payload cannot be encoded
     */
    List<Event> append(CommandContext context, List<PendingEvent> events);

    /**
     * Returns the events matching the query in ascending sequence order.
     *
     * @param context the invocation context
     * @param query   the stream filter
     * @return matching events, never null
     */
    List<Event> replay(CommandContext context, ReplayQuery query);

    /**
     * Returns the ids of all aggregates of the given type, in order of their first event.
     *
     * @param resourceOwner restricts to aggregates owned by this owner, or {@code null} for all
     */
    List<String> aggregateIds(CommandContext context, String aggregateType, String resourceOwner);
}
