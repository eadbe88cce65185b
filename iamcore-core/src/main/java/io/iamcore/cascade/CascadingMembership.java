package io.iamcore.cascade;

import io.iamcore.AggregateRef;
import io.iamcore.CommandContext;
import io.iamcore.IamAggregates;
import io.iamcore.PendingEvent;

import java.util.Objects;

/**
 * A membership that has to be removed together with its user.
 */
public sealed interface CascadingMembership {

    String userId();

    /**
     * Builds the removal event on the aggregate holding the membership.
     */
    PendingEvent removalEvent(CommandContext context);

    record Iam(String userId, String instanceId) implements CascadingMembership {
        public Iam {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(instanceId, "instanceId");
        }

        @Override
        public PendingEvent removalEvent(CommandContext context) {
            return PendingEvent.builder(MembershipEvents.IAM_MEMBER_CASCADE_REMOVED)
                    .aggregate(AggregateRef.of(IamAggregates.INSTANCE, instanceId, instanceId))
                    .payload(new MembershipEvents.MemberCascadeRemoved(userId))
                    .context(context)
                    .build();
        }
    }

    record Org(String userId, String orgId) implements CascadingMembership {
        public Org {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(orgId, "orgId");
        }

        @Override
        public PendingEvent removalEvent(CommandContext context) {
            return PendingEvent.builder(MembershipEvents.ORG_MEMBER_CASCADE_REMOVED)
                    .aggregate(AggregateRef.of(IamAggregates.ORG, orgId, orgId))
                    .payload(new MembershipEvents.MemberCascadeRemoved(userId))
                    .context(context)
                    .build();
        }
    }

    record Project(String userId, String projectId, String resourceOwner) implements CascadingMembership {
        public Project {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(projectId, "projectId");
        }

        @Override
        public PendingEvent removalEvent(CommandContext context) {
            return PendingEvent.builder(MembershipEvents.PROJECT_MEMBER_CASCADE_REMOVED)
                    .aggregate(AggregateRef.of(IamAggregates.PROJECT, projectId, resourceOwner))
                    .payload(new MembershipEvents.MemberCascadeRemoved(userId))
                    .context(context)
                    .build();
        }
    }

    record ProjectGrant(String userId, String projectId, String projectGrantId, String resourceOwner)
            implements CascadingMembership {
        public ProjectGrant {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(projectId, "projectId");
            Objects.requireNonNull(projectGrantId, "projectGrantId");
        }

        @Override
        public PendingEvent removalEvent(CommandContext context) {
            return PendingEvent.builder(MembershipEvents.PROJECT_GRANT_MEMBER_CASCADE_REMOVED)
                    .aggregate(AggregateRef.of(IamAggregates.PROJECT, projectId, resourceOwner))
                    .payload(new MembershipEvents.GrantMemberCascadeRemoved(userId, projectGrantId))
                    .context(context)
                    .build();
        }
    }
}
