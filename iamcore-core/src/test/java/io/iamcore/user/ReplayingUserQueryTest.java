package io.iamcore.user;

import io.iamcore.CommandContext;
import io.iamcore.cascade.DependentReferences;
import io.iamcore.command.CommandExecutor;
import io.iamcore.log.InMemoryEventLog;
import io.iamcore.spi.AesGcmSecretProvider;
import io.iamcore.spi.UserQuery;
import io.iamcore.spi.UserView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplayingUserQueryTest {
    private final InMemoryEventLog log = new InMemoryEventLog();
    private final UserCommands commands = new UserCommands(new CommandExecutor(log),
            new AesGcmSecretProvider("test-key", new byte[16]));
    private final ReplayingUserQuery query = new ReplayingUserQuery(log);
    private final CommandContext context = CommandContext.builder()
            .editorUser("admin")
            .instanceId("instance-1")
            .resourceOwner("org-1")
            .build();

    @BeforeEach
    void setUp() {
        for (int i = 1; i <= 4; i++) {
            commands.addHuman(context, new AddHuman("u" + i, "user" + i, "First" + i, "Last" + i, null, null, "en",
                    null, null, null, List.of(new MetadataEntry("k", "v" + i))));
        }
    }

    @Test
    void findByIdReturnsSnapshot() {
        UserView view = query.findById(context, "u2").orElseThrow();

        assertEquals("user2", view.userName());
        assertEquals("First2", view.firstName());
        assertEquals("org-1", view.resourceOwner());
        assertEquals("v2", view.metadata().get("k"));
        assertEquals(2, view.sequence());
        assertTrue(view.active());
    }

    @Test
    void removedAndUnknownUsersAreNotFound() {
        commands.removeUser(context, "u2", DependentReferences.none());

        assertTrue(query.findById(context, "u2").isEmpty());
        assertTrue(query.findById(context, "nobody").isEmpty());
    }

    @Test
    void inactiveUsersAreReturnedInactive() {
        commands.deactivateUser(context, "u3");

        assertFalse(query.findById(context, "u3").orElseThrow().active());
    }

    @Test
    void searchPagesInCreationOrder() {
        UserQuery.UserSearchResult page = query.search(context, 1, 2);

        assertEquals(4, page.totalCount());
        assertEquals(List.of("u2", "u3"), page.users().stream().map(UserView::id).toList());
    }

    @Test
    void searchWithZeroLimitCountsOnly() {
        commands.removeUser(context, "u1", DependentReferences.none());

        UserQuery.UserSearchResult page = query.search(context, 0, 0);

        assertEquals(3, page.totalCount());
        assertTrue(page.users().isEmpty());
    }

    @Test
    void searchIsScopedToResourceOwner() {
        CommandContext otherOrg = context.withResourceOwner("org-2");

        assertEquals(0, query.search(otherOrg, 0, 10).totalCount());
    }
}
