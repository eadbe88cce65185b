package io.iamcore.smtp;

import io.iamcore.CommandContext;
import io.iamcore.CommandException;
import io.iamcore.ObjectDetails;
import io.iamcore.ProtectedSecret;
import io.iamcore.command.ChangeSet;
import io.iamcore.command.CommandExecutor;
import io.iamcore.spi.SecretProvider;

import java.util.Objects;

/**
 * Commands managing the SMTP configuration of the context's instance.
 *
 * <p>Stateless and thread-safe.
 */
public final class SmtpConfigCommands {
    static final String NOT_FOUND = "Errors.SMTPConfig.NotFound";

    private final CommandExecutor executor;
    private final SecretProvider secrets;

    public SmtpConfigCommands(CommandExecutor executor, SecretProvider secrets) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.secrets = Objects.requireNonNull(secrets, "secrets");
    }

    /**
     * Creates the configuration. A removed configuration may be added again.
     *
     * @throws CommandException {@code ALREADY_EXISTS} if a configuration is active
     */
    public ObjectDetails addSmtpConfig(CommandContext context, SmtpConfig config) {
        Objects.requireNonNull(config, "config");
        return executor.run("smtp.add", context, () -> {
            validate(config);
            SmtpConfigWriteModel model = getSmtpConfig(context);
            if (model.isActive()) {
                throw CommandException.alreadyExists("SMTP-ALREADY-EXISTS", "Errors.SMTPConfig.AlreadyExists");
            }
            ProtectedSecret password = null;
            if (config.password() != null && !config.password().isEmpty()) {
                password = secrets.protect(config.password());
            }
            return executor.push(context, model,
                    executor.newEvent(context, model, SmtpConfigEvents.SMTP_CONFIG_ADDED)
                            .payload(new SmtpConfigEvents.Added(
                                    config.tls(),
                                    config.senderAddress(),
                                    config.senderName(),
                                    config.host(),
                                    config.user(),
                                    password))
                            .build());
        });
    }

    /**
     * Changes the non-secret fields. The config's password is ignored.
     *
     * @throws CommandException {@code NOT_FOUND} if no configuration is active,
     *                          {@code PRECONDITION_FAILED} if nothing would change
     */
    public ObjectDetails changeSmtpConfig(CommandContext context, SmtpConfig config) {
        Objects.requireNonNull(config, "config");
        return executor.run("smtp.change", context, () -> {
            validate(config);
            SmtpConfigWriteModel model = getActive(context);
            ChangeSet<SmtpConfigEvents.Changed> changes = model.newChangedEvent(config);
            if (!changes.hasChanges()) {
                throw CommandException.noChanges("SMTP-NO-CHANGES");
            }
            return executor.push(context, model,
                    executor.newEvent(context, model, SmtpConfigEvents.SMTP_CONFIG_CHANGED)
                            .payload(changes.payload())
                            .build());
        });
    }

    /**
     * Replaces the password. Always emits an event since protected values are not compared.
     *
     * @throws CommandException {@code NOT_FOUND} if no configuration is active
     */
    public ObjectDetails changeSmtpConfigPassword(CommandContext context, String password) {
        Objects.requireNonNull(password, "password");
        return executor.run("smtp.change-password", context, () -> {
            SmtpConfigWriteModel model = getActive(context);
            ProtectedSecret protectedPassword = secrets.protect(password);
            return executor.push(context, model,
                    executor.newEvent(context, model, SmtpConfigEvents.SMTP_CONFIG_PASSWORD_CHANGED)
                            .payload(new SmtpConfigEvents.PasswordChanged(protectedPassword))
                            .build());
        });
    }

    /**
     * @throws CommandException {@code NOT_FOUND} if no configuration is active
     */
    public ObjectDetails removeSmtpConfig(CommandContext context) {
        return executor.run("smtp.remove", context, () -> {
            SmtpConfigWriteModel model = getActive(context);
            return executor.push(context, model,
                    executor.newEvent(context, model, SmtpConfigEvents.SMTP_CONFIG_REMOVED)
                            .payload(new SmtpConfigEvents.Removed())
                            .build());
        });
    }

    /**
     * Returns the hydrated configuration of the context's instance, in any state.
     */
    public SmtpConfigWriteModel getSmtpConfig(CommandContext context) {
        return executor.hydrate(context, new SmtpConfigWriteModel(context.instanceId()));
    }

    private SmtpConfigWriteModel getActive(CommandContext context) {
        SmtpConfigWriteModel model = getSmtpConfig(context);
        if (!model.isActive()) {
            throw CommandException.notFound("SMTP-NOT-FOUND", NOT_FOUND);
        }
        return model;
    }

    private static void validate(SmtpConfig config) {
        if (isBlank(config.senderAddress()) || isBlank(config.host())) {
            throw CommandException.invalidArgument("SMTP-INVALID", "Errors.SMTPConfig.Invalid");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
