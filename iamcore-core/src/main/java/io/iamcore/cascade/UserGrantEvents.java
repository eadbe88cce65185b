package io.iamcore.cascade;

import io.iamcore.AggregateType;
import io.iamcore.EventPayload;
import io.iamcore.EventType;
import io.iamcore.IamAggregates;

/**
 * Events on user grant aggregates.
 */
public enum UserGrantEvents implements EventType {
    USER_GRANT_CASCADE_REMOVED(CascadeRemoved.class);

    private final Class<? extends EventPayload> payloadType;

    UserGrantEvents(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    @Override
    public AggregateType aggregateType() {
        return IamAggregates.USER_GRANT;
    }

    @Override
    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public record CascadeRemoved(String userId) implements EventPayload {
    }
}
