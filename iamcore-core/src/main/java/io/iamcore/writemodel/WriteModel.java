package io.iamcore.writemodel;

import io.iamcore.AggregateRef;
import io.iamcore.Event;
import io.iamcore.EventType;
import io.iamcore.spi.ReplayQuery;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Current state of one aggregate, derived by folding its events in order.
 *
 * <p>Subclasses hold the entity fields and implement {@link #reduce(Event)}. A write model is
 * created per command invocation, hydrated from the log, and then updated in place with the
 * events that the command appended.
 *
 * @see WriteModels#hydrate
 */
public abstract class WriteModel {
    private final AggregateRef aggregate;
    private long processedSequence;
    private Instant creationDate;
    private Instant changeDate;
    private String resourceOwner;
    private int foldedEvents;

    protected WriteModel(AggregateRef aggregate) {
        this.aggregate = Objects.requireNonNull(aggregate, "aggregate");
        this.resourceOwner = aggregate.resourceOwner();
    }

    public final AggregateRef aggregate() {
        return aggregate;
    }

    /**
     * Returns the sequence of the last event folded, {@code 0} before any event.
     */
    public final long processedSequence() {
        return processedSequence;
    }

    /**
     * Returns the creation time of the aggregate's first event, or {@code null}.
     */
    public final Instant creationDate() {
        return creationDate;
    }

    /**
     * Returns the creation time of the last event folded, or {@code null}.
     */
    public final Instant changeDate() {
        return changeDate;
    }

    /**
     * Returns the owner recorded on the stream, falling back to the one this model was
     * created with.
     */
    public final String resourceOwner() {
        return resourceOwner;
    }

    /**
     * Returns the number of events folded into this model so far.
     */
    public final int foldedEvents() {
        return foldedEvents;
    }

    /**
     * Event types this model reacts to. Empty means every event of the stream is replayed,
     * which is required for the model to know the aggregate's head sequence.
     */
    protected List<EventType> eventTypes() {
        return List.of();
    }

    /**
     * Returns the replay query that hydrates this model.
     */
    public ReplayQuery query() {
        return queryBuilder().build();
    }

    protected ReplayQuery.Builder queryBuilder() {
        return ReplayQuery.builder(aggregate.type(), aggregate.id())
                .eventTypes(eventTypes());
    }

    /**
     * Folds an ordered batch of events.
     *
     * <p>Events addressed to other aggregates are skipped. Every event of this aggregate must
     * carry a sequence greater than {@link #processedSequence()}.
     *
     * @throws IllegalStateException if an event is out of order
     */
    public final void apply(List<Event> events) {
        Objects.requireNonNull(events, "events");
        for (Event event : events) {
            if (!aggregate.sameStream(event.aggregate())) {
                continue;
            }
            if (event.sequence() <= processedSequence) {
                throw new IllegalStateException("Event " + event.eventId() + " with sequence "
                        + event.sequence() + " is not after processed sequence " + processedSequence
                        + " of " + aggregate);
            }
            reduce(event);
            if (creationDate == null) {
                creationDate = event.createdAt();
            }
            if (event.aggregate().resourceOwner() != null) {
                resourceOwner = event.aggregate().resourceOwner();
            }
            changeDate = event.createdAt();
            processedSequence = event.sequence();
            foldedEvents++;
        }
    }

    /**
     * Applies one event to the entity fields. Unknown event types must be ignored.
     */
    protected abstract void reduce(Event event);
}
