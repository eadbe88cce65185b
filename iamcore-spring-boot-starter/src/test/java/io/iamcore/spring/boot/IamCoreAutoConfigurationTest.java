package io.iamcore.spring.boot;

import io.iamcore.CommandContext;
import io.iamcore.Event;
import io.iamcore.ProtectedSecret;
import io.iamcore.cascade.CascadeResolver;
import io.iamcore.cascade.MembershipEvents;
import io.iamcore.command.CommandExecutor;
import io.iamcore.jdbc.JdbcEventLog;
import io.iamcore.jdbc.store.AbstractJdbcEventStore;
import io.iamcore.jdbc.store.H2EventStore;
import io.iamcore.resource.ListRequest;
import io.iamcore.resource.ListResponse;
import io.iamcore.resource.UserResource;
import io.iamcore.resource.UsersHandler;
import io.iamcore.smtp.SmtpConfig;
import io.iamcore.smtp.SmtpConfigCommands;
import io.iamcore.smtp.SmtpConfigState;
import io.iamcore.spi.DependentEntityQuery;
import io.iamcore.spi.EventLog;
import io.iamcore.spi.ReplayQuery;
import io.iamcore.spi.SecretProvider;
import io.iamcore.spi.UserQuery;
import io.iamcore.user.ReplayingUserQuery;
import io.iamcore.user.UserCommands;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class IamCoreAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    SqlInitializationAutoConfiguration.class,
                    IamCoreAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:iam_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                    "spring.datasource.driver-class-name=org.h2.Driver",
                    "spring.sql.init.schema-locations=classpath:schema/h2.sql",
                    "iamcore.secret-key=AAECAwQFBgcICQoLDA0ODw==",
                    "iamcore.scim.base-url=https://iam.example.com/scim/v2/");

    private final CommandContext context = CommandContext.builder()
            .editorUser("admin")
            .instanceId("instance-1")
            .resourceOwner("org-1")
            .build();

    @Test
    void createsAllBeans() {
        runner.withUserConfiguration(MembershipIndexConfig.class).run(ctx -> {
            assertInstanceOf(H2EventStore.class, ctx.getBean(AbstractJdbcEventStore.class));
            assertInstanceOf(JdbcEventLog.class, ctx.getBean(EventLog.class));
            assertNotNull(ctx.getBean(SecretProvider.class));
            assertNotNull(ctx.getBean(CommandExecutor.class));
            assertNotNull(ctx.getBean(SmtpConfigCommands.class));
            assertNotNull(ctx.getBean(UserCommands.class));
            assertNotNull(ctx.getBean(CascadeResolver.class));
            assertSame(MembershipIndexConfig.INDEX, ctx.getBean(DependentEntityQuery.class));
            assertInstanceOf(ReplayingUserQuery.class, ctx.getBean(UserQuery.class));
            assertNotNull(ctx.getBean(UsersHandler.class));
        });
    }

    @Test
    void noUsersHandlerWithoutDependentEntityQuery() {
        runner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertEquals(0, ctx.getBeanNamesForType(DependentEntityQuery.class).length);
            assertFalse(ctx.containsBean("cascadeResolver"));
            assertFalse(ctx.containsBean("usersHandler"));
            assertNotNull(ctx.getBean(UserCommands.class));
        });
    }

    @Test
    void removingUserCascadesThroughApplicationQuery() {
        runner.withUserConfiguration(MembershipIndexConfig.class).run(ctx -> {
            UsersHandler handler = ctx.getBean(UsersHandler.class);
            UserResource created = handler.create(context, UserResource.builder()
                    .userName("jane")
                    .name(new UserResource.Name("Jane Doe", "Doe", "Jane", null, null, null))
                    .emails(List.of(new UserResource.Email("jane@example.com", true)))
                    .build());
            MembershipIndexConfig.INDEX.memberships = List.of(new DependentEntityQuery.MembershipRecord(
                    DependentEntityQuery.MembershipKind.ORG, created.id(), "org-1", "org-1", null));

            handler.delete(context, created.id());

            List<Event> orgEvents = ctx.getBean(EventLog.class)
                    .replay(context, ReplayQuery.builder("ORG", "org-1").build());
            assertEquals(1, orgEvents.size());
            assertSame(MembershipEvents.ORG_MEMBER_CASCADE_REMOVED, orgEvents.get(0).type());
        });
    }

    @Test
    void provisionsUsersThroughTheHandler() {
        runner.withUserConfiguration(MembershipIndexConfig.class).run(ctx -> {
            UsersHandler handler = ctx.getBean(UsersHandler.class);

            UserResource created = handler.create(context, UserResource.builder()
                    .userName("jane")
                    .name(new UserResource.Name("Jane Doe", "Doe", "Jane", null, null, null))
                    .emails(List.of(new UserResource.Email("jane@example.com", true)))
                    .title("Engineer")
                    .build());
            UserResource loaded = handler.get(context, created.id());
            ListResponse<UserResource> page = handler.list(context, ListRequest.firstPage());

            assertEquals("jane", loaded.userName());
            assertEquals("Engineer", loaded.title());
            assertEquals("https://iam.example.com/scim/v2/Users/" + created.id(), loaded.meta().location());
            assertEquals(1, page.totalResults());
        });
    }

    @Test
    void smtpPasswordIsStoredProtected() {
        runner.run(ctx -> {
            SmtpConfigCommands smtp = ctx.getBean(SmtpConfigCommands.class);
            smtp.addSmtpConfig(context, new SmtpConfig(true, "noreply@example.com", "IAM",
                    "smtp.example.com:587", "mailer", "s3cret"));

            ProtectedSecret password = smtp.getSmtpConfig(context).password();

            assertEquals(SmtpConfigState.ACTIVE, smtp.getSmtpConfig(context).state());
            assertEquals("s3cret", ctx.getBean(SecretProvider.class).reveal(password));
        });
    }

    @Test
    void customTableName() {
        runner.withPropertyValues("iamcore.table-name=tenant_event").run(ctx -> {
            AbstractJdbcEventStore store = ctx.getBean(AbstractJdbcEventStore.class);
            assertInstanceOf(H2EventStore.class, store);
            assertEquals("tenant_event", store.tableName());
        });
    }

    @Test
    void missingSecretKeyFailsStartup() {
        runner.withPropertyValues("iamcore.secret-key=").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
    }

    @Test
    void notLoadedWithoutDataSource() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(IamCoreAutoConfiguration.class))
                .run(ctx -> {
                    assertFalse(ctx.containsBean("eventLog"));
                    assertFalse(ctx.containsBean("userCommands"));
                });
    }

    @Test
    void respectsConditionalOnMissingBean() {
        runner.withPropertyValues("iamcore.secret-key=")
                .withUserConfiguration(CustomBeansConfig.class)
                .run(ctx -> {
                    assertNull(ctx.getStartupFailure());
                    assertSame(CustomBeansConfig.SECRETS, ctx.getBean(SecretProvider.class));
                    assertEquals(1, ctx.getBeanNamesForType(DependentEntityQuery.class).length);
                    assertEquals("membershipIndex", ctx.getBeanNamesForType(DependentEntityQuery.class)[0]);
                    assertNotNull(ctx.getBean(UsersHandler.class));
                });
    }

    private static Throwable findRootCause(Throwable t) {
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t;
    }

    @Configuration
    static class MembershipIndexConfig {
        static final MembershipIndex INDEX = new MembershipIndex();

        @Bean
        DependentEntityQuery membershipIndex() {
            return INDEX;
        }
    }

    static class MembershipIndex implements DependentEntityQuery {
        volatile List<MembershipRecord> memberships = List.of();

        @Override
        public List<MembershipRecord> findMembershipsFor(CommandContext context, String userId) {
            return memberships.stream().filter(m -> m.userId().equals(userId)).toList();
        }

        @Override
        public List<GrantRecord> findGrantsFor(CommandContext context, String userId) {
            return List.of();
        }
    }

    @Configuration
    static class CustomBeansConfig {
        static final SecretProvider SECRETS = new SecretProvider() {
            @Override
            public ProtectedSecret protect(String plaintext) {
                return new ProtectedSecret("none", "test", plaintext);
            }

            @Override
            public String reveal(ProtectedSecret secret) {
                return secret.ciphertext();
            }
        };

        @Bean
        SecretProvider customSecrets() {
            return SECRETS;
        }

        @Bean
        DependentEntityQuery membershipIndex() {
            return DependentEntityQuery.NONE;
        }
    }
}
