package io.iamcore;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;

/**
 * An event built by a command but not yet appended to the log.
 *
 * <p>Each pending event is assigned a ULID-based {@code eventId} by default. The log assigns
 * the per-aggregate sequence and the creation timestamp on append.
 *
 * <p>{@code expectedSequence} is the aggregate head the command observed while validating.
 * When set, the log rejects the whole batch with
 * {@link ErrorKind#CONCURRENCY_CONFLICT} if the head has moved since.
 *
 * @see io.iamcore.spi.EventLog#append
 */
public final class PendingEvent {
    public static final long ANY_SEQUENCE = -1L;

    private final String eventId;
    private final AggregateRef aggregate;
    private final EventType type;
    private final EventPayload payload;
    private final String editorUser;
    private final long expectedSequence;

    private PendingEvent(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        this.type = Objects.requireNonNull(builder.type, "type");
        this.aggregate = Objects.requireNonNull(builder.aggregate, "aggregate");
        this.payload = Objects.requireNonNull(builder.payload, "payload");
        this.editorUser = builder.editorUser;
        this.expectedSequence = builder.expectedSequence;

        if (!type.aggregateType().name().equals(aggregate.type())) {
            throw new IllegalArgumentException("Event type " + type.name()
                    + " does not belong to aggregate type " + aggregate.type());
        }
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getName()
                    + " is not a " + type.payloadType().getName());
        }
        if (expectedSequence < ANY_SEQUENCE) {
            throw new IllegalArgumentException("expectedSequence must be >= 0 or ANY_SEQUENCE");
        }
    }

    /**
     * Creates a builder for the given event type.
     *
     * @param type the event type
     * @return a new builder
     */
    public static Builder builder(EventType type) {
        Objects.requireNonNull(type, "type");
        return new Builder(type);
    }

    public String eventId() {
        return eventId;
    }

    public AggregateRef aggregate() {
        return aggregate;
    }

    public EventType type() {
        return type;
    }

    public EventPayload payload() {
        return payload;
    }

    public String editorUser() {
        return editorUser;
    }

    /**
     * Returns the expected aggregate head, or {@link #ANY_SEQUENCE} when the append is
     * unconditional.
     */
    public long expectedSequence() {
        return expectedSequence;
    }

    public boolean hasExpectedSequence() {
        return expectedSequence != ANY_SEQUENCE;
    }

    @Override
    public String toString() {
        return "PendingEvent{eventId=" + eventId
                + ", type=" + type.name()
                + ", aggregate=" + aggregate
                + (hasExpectedSequence() ? ", expectedSequence=" + expectedSequence : "")
                + '}';
    }

    /**
     * Builder for {@link PendingEvent}.
     */
    public static final class Builder {
        private final EventType type;
        private String eventId;
        private AggregateRef aggregate;
        private EventPayload payload;
        private String editorUser;
        private long expectedSequence = ANY_SEQUENCE;

        private Builder(EventType type) {
            this.type = type;
        }

        /**
         * Sets a custom event identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the aggregate this event is appended to. Required.
         */
        public Builder aggregate(AggregateRef aggregate) {
            this.aggregate = aggregate;
            return this;
        }

        /**
         * Sets the typed payload. Required, must match {@link EventType#payloadType()}.
         */
        public Builder payload(EventPayload payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Sets the editor (acting user) recorded with the event.
         */
        public Builder editorUser(String editorUser) {
            this.editorUser = editorUser;
            return this;
        }

        /**
         * Copies the editor from the command context.
         */
        public Builder context(CommandContext context) {
            this.editorUser = Objects.requireNonNull(context, "context").editorUser();
            return this;
        }

        /**
         * Sets the aggregate head the command validated against.
         *
         * <p>Optional. Defaults to {@link #ANY_SEQUENCE} (no concurrency check).
         */
        public Builder expectedSequence(long expectedSequence) {
            this.expectedSequence = expectedSequence;
            return this;
        }

        /**
         * Builds an immutable {@link PendingEvent}.
         *
         * @throws IllegalArgumentException if the payload does not match the event type or the
         *                                  aggregate type differs from the event type's
         */
        public PendingEvent build() {
            return new PendingEvent(this);
        }
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
