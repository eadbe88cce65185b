package io.iamcore.spi;

import io.iamcore.CommandContext;

import java.util.List;
import java.util.Optional;

/**
 * Read-side user lookups used by the resource handlers for get and list.
 */
public interface UserQuery {

    Optional<UserView> findById(CommandContext context, String userId);

    /**
     * Returns one page of users owned by the context's resource owner.
     *
     * @param offset zero-based offset
     * @param limit  maximum number of users; {@code 0} returns only the total count
     */
    UserSearchResult search(CommandContext context, int offset, int limit);

    /**
     * Result page of {@link #search}.
     *
     * @param totalCount total users matching, independent of paging
     * @param users      the page
     */
    record UserSearchResult(long totalCount, List<UserView> users) {
        public UserSearchResult {
            users = List.copyOf(users);
        }
    }
}
