package io.iamcore.spring.boot;

import io.iamcore.cascade.CascadeResolver;
import io.iamcore.codec.EventCodec;
import io.iamcore.codec.EventTypeRegistry;
import io.iamcore.codec.JacksonEventCodec;
import io.iamcore.command.CommandExecutor;
import io.iamcore.jdbc.JdbcEventLog;
import io.iamcore.jdbc.store.AbstractJdbcEventStore;
import io.iamcore.jdbc.store.JdbcEventStores;
import io.iamcore.resource.UsersHandler;
import io.iamcore.resource.UsersHandlerConfig;
import io.iamcore.resource.metadata.UserMetadataMapper;
import io.iamcore.smtp.SmtpConfigCommands;
import io.iamcore.spi.AesGcmSecretProvider;
import io.iamcore.spi.DependentEntityQuery;
import io.iamcore.spi.EventLog;
import io.iamcore.spi.MetricsExporter;
import io.iamcore.spi.SecretProvider;
import io.iamcore.spi.UserQuery;
import io.iamcore.user.ReplayingUserQuery;
import io.iamcore.user.UserCommands;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for iamcore.
 *
 * <p>Wires a {@link JdbcEventLog} from the application's {@link DataSource} and exposes the
 * command, query and resource handler beans on top of it. Every bean backs off when the
 * application defines its own. The users handler is only created once the application provides
 * a {@link DependentEntityQuery} (or its own {@link CascadeResolver}).
 *
 * @see IamCoreProperties
 * @see IamCoreMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcEventLog.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(IamCoreProperties.class)
public class IamCoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcEventStore eventStore(DataSource dataSource, IamCoreProperties props) {
        return JdbcEventStores.detect(dataSource, props.getTableName());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventTypeRegistry eventTypeRegistry() {
        return EventTypeRegistry.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventCodec eventCodec() {
        return new JacksonEventCodec();
    }

    @Bean
    @ConditionalOnMissingBean(EventLog.class)
    public JdbcEventLog eventLog(DataSource dataSource,
                                 AbstractJdbcEventStore eventStore,
                                 EventCodec eventCodec,
                                 EventTypeRegistry eventTypeRegistry) {
        return JdbcEventLog.builder()
                .store(eventStore)
                .dataSource(dataSource)
                .codec(eventCodec)
                .registry(eventTypeRegistry)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretProvider secretProvider(IamCoreProperties props) {
        String key = props.getSecretKey();
        if (key == null || key.isBlank()) {
            throw new IllegalStateException(
                    "iamcore.secret-key must be set to a Base64 AES key, or a SecretProvider bean defined");
        }
        return AesGcmSecretProvider.fromBase64(props.getSecretKeyId(), key);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandExecutor commandExecutor(EventLog eventLog, ObjectProvider<MetricsExporter> metricsProvider) {
        return new CommandExecutor(eventLog, metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    }

    @Bean
    @ConditionalOnMissingBean
    public SmtpConfigCommands smtpConfigCommands(CommandExecutor executor, SecretProvider secretProvider) {
        return new SmtpConfigCommands(executor, secretProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    public UserCommands userCommands(CommandExecutor executor, SecretProvider secretProvider) {
        return new UserCommands(executor, secretProvider);
    }

    /**
     * Requires an application {@link DependentEntityQuery}; without one, removing a user could not
     * cascade to its memberships and grants, so neither this nor {@link #usersHandler} is created.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DependentEntityQuery.class)
    public CascadeResolver cascadeResolver(DependentEntityQuery dependentEntityQuery) {
        return new CascadeResolver(dependentEntityQuery);
    }

    @Bean
    @ConditionalOnMissingBean
    public UserQuery userQuery(EventLog eventLog) {
        return new ReplayingUserQuery(eventLog);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CascadeResolver.class)
    public UsersHandler usersHandler(UserCommands userCommands,
                                     CascadeResolver cascadeResolver,
                                     UserQuery userQuery,
                                     IamCoreProperties props) {
        IamCoreProperties.Scim scim = props.getScim();
        return new UsersHandler(userCommands, cascadeResolver, userQuery, new UserMetadataMapper(),
                new UsersHandlerConfig(scim.isEmailVerified(), scim.isPhoneVerified(), scim.getBaseUrl()));
    }
}
