package io.iamcore.spi;

import io.iamcore.CommandContext;

import java.util.List;

/**
 * Read-side lookup of entities that depend on a user and must be removed with it.
 *
 * <p>Results may lag the event log slightly; callers treat them as a best-effort snapshot.
 */
public interface DependentEntityQuery {

    /**
     * No-op instance reporting no dependents.
     */
    DependentEntityQuery NONE = new DependentEntityQuery() {
        @Override
        public List<MembershipRecord> findMembershipsFor(CommandContext context, String userId) {
            return List.of();
        }

        @Override
        public List<GrantRecord> findGrantsFor(CommandContext context, String userId) {
            return List.of();
        }
    };

    /**
     * Returns every membership the user holds, across instance, organizations, projects and
     * project grants.
     */
    List<MembershipRecord> findMembershipsFor(CommandContext context, String userId);

    /**
     * Returns every authorization grant given to the user.
     */
    List<GrantRecord> findGrantsFor(CommandContext context, String userId);

    /**
     * Membership scopes.
     */
    enum MembershipKind {
        IAM,
        ORG,
        PROJECT,
        PROJECT_GRANT
    }

    /**
     * A membership row.
     *
     * @param kind           the membership scope
     * @param userId         the member
     * @param aggregateId    the id of the instance, organization or project holding the membership
     * @param resourceOwner  the owner of that aggregate
     * @param projectGrantId the project grant id, set only for {@link MembershipKind#PROJECT_GRANT}
     */
    record MembershipRecord(
            MembershipKind kind,
            String userId,
            String aggregateId,
            String resourceOwner,
            String projectGrantId) {
    }

    /**
     * A user grant row.
     *
     * @param grantId       the user grant aggregate id
     * @param resourceOwner the owner of the grant
     */
    record GrantRecord(String grantId, String resourceOwner) {
    }
}
