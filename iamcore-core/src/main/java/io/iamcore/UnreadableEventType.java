package io.iamcore;

import java.util.Objects;

/**
 * Stands in for a stored event this reader cannot interpret, either because its type name is
 * not registered or because its payload cannot be decoded.
 *
 * <p>Event logs still hand such events to write models, carrying an {@link UnreadablePayload},
 * so the model's processed sequence keeps up with the stream head. Reducers switch on their
 * own event enums and therefore ignore it.
 *
 * @param name          the stored event type name
 * @param aggregateType the stored aggregate type
 */
public record UnreadableEventType(String name, AggregateType aggregateType) implements EventType {

    public UnreadableEventType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(aggregateType, "aggregateType");
    }

    /**
     * Creates the placeholder for a stored row, resolving built-in aggregate type names.
     */
    public static UnreadableEventType of(String name, String aggregateTypeName) {
        Objects.requireNonNull(aggregateTypeName, "aggregateTypeName");
        for (IamAggregates builtIn : IamAggregates.values()) {
            if (builtIn.name().equals(aggregateTypeName)) {
                return new UnreadableEventType(name, builtIn);
            }
        }
        return new UnreadableEventType(name, new StoredAggregateType(aggregateTypeName));
    }

    @Override
    public Class<? extends EventPayload> payloadType() {
        return UnreadablePayload.class;
    }

    /**
     * Aggregate type known only by its stored name.
     */
    public record StoredAggregateType(String name) implements AggregateType {
        public StoredAggregateType {
            Objects.requireNonNull(name, "name");
        }
    }
}
