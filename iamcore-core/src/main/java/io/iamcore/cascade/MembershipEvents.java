package io.iamcore.cascade;

import io.iamcore.AggregateType;
import io.iamcore.EventPayload;
import io.iamcore.EventType;
import io.iamcore.IamAggregates;

/**
 * Membership removals emitted on the holding aggregate when a member user is removed.
 */
public enum MembershipEvents implements EventType {
    IAM_MEMBER_CASCADE_REMOVED(IamAggregates.INSTANCE, MemberCascadeRemoved.class),
    ORG_MEMBER_CASCADE_REMOVED(IamAggregates.ORG, MemberCascadeRemoved.class),
    PROJECT_MEMBER_CASCADE_REMOVED(IamAggregates.PROJECT, MemberCascadeRemoved.class),
    PROJECT_GRANT_MEMBER_CASCADE_REMOVED(IamAggregates.PROJECT, GrantMemberCascadeRemoved.class);

    private final AggregateType aggregateType;
    private final Class<? extends EventPayload> payloadType;

    MembershipEvents(AggregateType aggregateType, Class<? extends EventPayload> payloadType) {
        this.aggregateType = aggregateType;
        this.payloadType = payloadType;
    }

    @Override
    public AggregateType aggregateType() {
        return aggregateType;
    }

    @Override
    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public record MemberCascadeRemoved(String userId) implements EventPayload {
    }

    public record GrantMemberCascadeRemoved(String userId, String projectGrantId) implements EventPayload {
    }
}
