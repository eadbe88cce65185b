package io.iamcore.cascade;

import io.iamcore.AggregateRef;
import io.iamcore.CommandContext;
import io.iamcore.IamAggregates;
import io.iamcore.PendingEvent;

import java.util.Objects;

/**
 * A user grant that has to be removed together with its user.
 */
public record GrantReference(String grantId, String resourceOwner) {

    public GrantReference {
        Objects.requireNonNull(grantId, "grantId");
    }

    public PendingEvent removalEvent(CommandContext context, String userId) {
        return PendingEvent.builder(UserGrantEvents.USER_GRANT_CASCADE_REMOVED)
                .aggregate(AggregateRef.of(IamAggregates.USER_GRANT, grantId, resourceOwner))
                .payload(new UserGrantEvents.CascadeRemoved(userId))
                .context(context)
                .build();
    }
}
