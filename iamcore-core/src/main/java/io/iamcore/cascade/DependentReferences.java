package io.iamcore.cascade;

import io.iamcore.CommandContext;
import io.iamcore.PendingEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Memberships and grants of one user, resolved for a single delete.
 */
public record DependentReferences(List<CascadingMembership> memberships, List<GrantReference> grants) {
    private static final DependentReferences NONE = new DependentReferences(List.of(), List.of());

    public DependentReferences {
        memberships = List.copyOf(memberships);
        grants = List.copyOf(grants);
    }

    public static DependentReferences none() {
        return NONE;
    }

    public int size() {
        return memberships.size() + grants.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Builds one removal event per dependent, memberships first.
     */
    public List<PendingEvent> removalEvents(CommandContext context, String userId) {
        List<PendingEvent> events = new ArrayList<>(size());
        for (CascadingMembership membership : memberships) {
            events.add(membership.removalEvent(context));
        }
        for (GrantReference grant : grants) {
            events.add(grant.removalEvent(context, userId));
        }
        return events;
    }
}
