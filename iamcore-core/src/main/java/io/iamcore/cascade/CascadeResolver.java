package io.iamcore.cascade;

import io.iamcore.CommandContext;
import io.iamcore.CommandException;
import io.iamcore.spi.DependentEntityQuery;
import io.iamcore.spi.DependentEntityQuery.GrantRecord;
import io.iamcore.spi.DependentEntityQuery.MembershipRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects the memberships and grants that must be removed together with a user.
 *
 * <p>With an {@link Executor} the two lookups run concurrently; both are awaited before the
 * result is returned. A failure of either lookup fails the whole resolution, so no cascade
 * is ever built from partial results.
 */
public final class CascadeResolver {
    private static final Logger logger = Logger.getLogger(CascadeResolver.class.getName());

    private final DependentEntityQuery query;
    private final Executor executor;

    /**
     * Creates a resolver that runs both lookups on the calling thread.
     */
    public CascadeResolver(DependentEntityQuery query) {
        this(query, null);
    }

    /**
     * @param query    the dependent lookup
     * @param executor runs the lookups concurrently; {@code null} runs them on the caller
     */
    public CascadeResolver(DependentEntityQuery query, Executor executor) {
        this.query = Objects.requireNonNull(query, "query");
        this.executor = executor;
    }

    public DependentReferences resolve(CommandContext context, String userId) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(userId, "userId");
        List<MembershipRecord> memberships;
        List<GrantRecord> grants;
        if (executor == null) {
            memberships = findMemberships(context, userId);
            grants = findGrants(context, userId);
        } else {
            CompletableFuture<List<MembershipRecord>> membershipsFuture =
                    CompletableFuture.supplyAsync(() -> findMemberships(context, userId), executor);
            CompletableFuture<List<GrantRecord>> grantsFuture =
                    CompletableFuture.supplyAsync(() -> findGrants(context, userId), executor);
            try {
                CompletableFuture.allOf(membershipsFuture, grantsFuture).join();
            } catch (CompletionException e) {
                throw unwrap(e);
            }
            memberships = membershipsFuture.join();
            grants = grantsFuture.join();
        }

        List<CascadingMembership> cascading = new ArrayList<>(memberships.size());
        for (MembershipRecord record : memberships) {
            cascading.add(toCascading(record));
        }
        List<GrantReference> grantReferences = new ArrayList<>(grants.size());
        for (GrantRecord grant : grants) {
            grantReferences.add(new GrantReference(grant.grantId(), grant.resourceOwner()));
        }
        logger.log(Level.FINE, "Resolved {0} membership(s) and {1} grant(s) for user {2}",
                new Object[] {cascading.size(), grantReferences.size(), userId});
        return new DependentReferences(cascading, grantReferences);
    }

    static CascadingMembership toCascading(MembershipRecord record) {
        return switch (record.kind()) {
            case IAM -> new CascadingMembership.Iam(record.userId(), record.aggregateId());
            case ORG -> new CascadingMembership.Org(record.userId(), record.aggregateId());
            case PROJECT -> new CascadingMembership.Project(
                    record.userId(), record.aggregateId(), record.resourceOwner());
            case PROJECT_GRANT -> new CascadingMembership.ProjectGrant(
                    record.userId(), record.aggregateId(), record.projectGrantId(), record.resourceOwner());
        };
    }

    private List<MembershipRecord> findMemberships(CommandContext context, String userId) {
        context.checkActive();
        try {
            return query.findMembershipsFor(context, userId);
        } catch (CommandException e) {
            throw e;
        } catch (RuntimeException e) {
            throw CommandException.unavailable("CASCADE-MEMBERSHIPS", e);
        }
    }

    private List<GrantRecord> findGrants(CommandContext context, String userId) {
        context.checkActive();
        try {
            return query.findGrantsFor(context, userId);
        } catch (CommandException e) {
            throw e;
        } catch (RuntimeException e) {
            throw CommandException.unavailable("CASCADE-GRANTS", e);
        }
    }

    private static CommandException unwrap(CompletionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        if (cause instanceof CommandException) {
            return (CommandException) cause;
        }
        return CommandException.unavailable("CASCADE-QUERY", cause);
    }
}
