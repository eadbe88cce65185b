package io.iamcore.spi;

import io.iamcore.AggregateType;
import io.iamcore.EventType;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Filter for {@link EventLog#replay}: one aggregate stream, optionally restricted to a set of
 * event types and bounded by a maximum sequence.
 */
public final class ReplayQuery {
    private final String aggregateType;
    private final String aggregateId;
    private final String resourceOwner;
    private final Set<String> eventTypes;
    private final long sequenceAtMost;

    private ReplayQuery(Builder builder) {
        this.aggregateType = Objects.requireNonNull(builder.aggregateType, "aggregateType");
        this.aggregateId = Objects.requireNonNull(builder.aggregateId, "aggregateId");
        this.resourceOwner = builder.resourceOwner;
        this.eventTypes = Set.copyOf(builder.eventTypes);
        this.sequenceAtMost = builder.sequenceAtMost;
    }

    public static Builder builder(AggregateType aggregateType, String aggregateId) {
        return new Builder(Objects.requireNonNull(aggregateType, "aggregateType").name(), aggregateId);
    }

    public static Builder builder(String aggregateType, String aggregateId) {
        return new Builder(aggregateType, aggregateId);
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }

    /**
     * Returns the resource owner filter, or {@code null} for any owner.
     */
    public String resourceOwner() {
        return resourceOwner;
    }

    /**
     * Returns the event type names to include. Empty means all types.
     */
    public Set<String> eventTypes() {
        return eventTypes;
    }

    /**
     * Returns the inclusive upper sequence bound, or {@link Long#MAX_VALUE} when unbounded.
     */
    public long sequenceAtMost() {
        return sequenceAtMost;
    }

    /**
     * Returns whether the query observes every event of the stream, so the last replayed
     * sequence is the aggregate's head.
     */
    public boolean isFullStream() {
        return eventTypes.isEmpty() && resourceOwner == null && sequenceAtMost == Long.MAX_VALUE;
    }

    /**
     * Returns whether an event with the given type name and sequence passes the type and
     * sequence filters. Aggregate identity is checked by the caller.
     */
    public boolean matches(String eventTypeName, long sequence) {
        return sequence <= sequenceAtMost
                && (eventTypes.isEmpty() || eventTypes.contains(eventTypeName));
    }

    @Override
    public String toString() {
        return "ReplayQuery{" + aggregateType + "/" + aggregateId
                + (eventTypes.isEmpty() ? "" : ", eventTypes=" + eventTypes)
                + (sequenceAtMost == Long.MAX_VALUE ? "" : ", sequenceAtMost=" + sequenceAtMost)
                + '}';
    }

    public static final class Builder {
        private final String aggregateType;
        private final String aggregateId;
        private String resourceOwner;
        private final Set<String> eventTypes = new LinkedHashSet<>();
        private long sequenceAtMost = Long.MAX_VALUE;

        private Builder(String aggregateType, String aggregateId) {
            this.aggregateType = aggregateType;
            this.aggregateId = aggregateId;
        }

        public Builder resourceOwner(String resourceOwner) {
            this.resourceOwner = resourceOwner;
            return this;
        }

        public Builder eventTypes(EventType... types) {
            return eventTypes(Arrays.asList(types));
        }

        public Builder eventTypes(Collection<? extends EventType> types) {
            for (EventType type : types) {
                eventTypes.add(type.name());
            }
            return this;
        }

        /**
         * Bounds the replay for point-in-time reconstruction.
         */
        public Builder sequenceAtMost(long sequenceAtMost) {
            if (sequenceAtMost < 0) {
                throw new IllegalArgumentException("sequenceAtMost must be >= 0");
            }
            this.sequenceAtMost = sequenceAtMost;
            return this;
        }

        public ReplayQuery build() {
            return new ReplayQuery(this);
        }
    }
}
