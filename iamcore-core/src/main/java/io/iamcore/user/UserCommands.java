package io.iamcore.user;

import com.github.f4b6a3.ulid.UlidCreator;
import io.iamcore.CommandContext;
import io.iamcore.CommandException;
import io.iamcore.ErrorKind;
import io.iamcore.ObjectDetails;
import io.iamcore.PendingEvent;
import io.iamcore.ProtectedSecret;
import io.iamcore.cascade.DependentReferences;
import io.iamcore.command.ChangeSet;
import io.iamcore.command.CommandExecutor;
import io.iamcore.spi.SecretProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Commands on human users.
 *
 * <p>Multi-event commands append all of their events in one batch. Only the first event of a
 * batch carries the expected aggregate head; later events on the same aggregate follow it.
 */
public final class UserCommands {
    private static final Logger logger = Logger.getLogger(UserCommands.class.getName());
    static final String NOT_FOUND = "Errors.User.NotFound";

    private final CommandExecutor executor;
    private final SecretProvider secrets;

    public UserCommands(CommandExecutor executor, SecretProvider secrets) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.secrets = Objects.requireNonNull(secrets, "secrets");
    }

    /**
     * Creates a human user owned by the context's resource owner, together with its metadata.
     * An inactive user is created and deactivated in the same append.
     *
     * @throws CommandException {@code INVALID_ARGUMENT} without user name,
     *                          {@code ALREADY_EXISTS} if the id was used before
     */
    public ObjectDetails addHuman(CommandContext context, AddHuman human) {
        Objects.requireNonNull(human, "human");
        return executor.run("user.add-human", context, () -> {
            if (human.userName() == null || human.userName().isBlank()) {
                throw CommandException.invalidArgument("USER-USERNAME-EMPTY", "Errors.User.Username.Empty");
            }
            String userId = human.userId() != null ? human.userId() : newUserId();
            HumanWriteModel model = executor.hydrate(context, new HumanWriteModel(userId, context.resourceOwner()));
            if (model.state() != UserState.UNSPECIFIED) {
                throw CommandException.alreadyExists("USER-ALREADY-EXISTS", "Errors.User.AlreadyExisting");
            }

            AddHuman.Email email = human.email();
            AddHuman.Phone phone = human.phone();
            List<PendingEvent> events = new ArrayList<>();
            events.add(executor.newEvent(context, model, UserEvents.HUMAN_ADDED)
                    .payload(new UserEvents.HumanAdded(
                            human.userName(),
                            human.firstName(),
                            human.lastName(),
                            human.nickName(),
                            human.displayName(),
                            human.preferredLanguage(),
                            email == null ? null : emptyToNull(email.address()),
                            email != null && email.verified(),
                            phone == null ? null : emptyToNull(phone.number()),
                            phone != null && phone.verified(),
                            protect(human.password())))
                    .build());
            for (MetadataEntry entry : human.metadata()) {
                if (!entry.value().isEmpty()) {
                    events.add(metadataSet(context, model, entry));
                }
            }
            if (!human.active()) {
                events.add(nextEvent(context, model, events, UserEvents.USER_DEACTIVATED)
                        .payload(new UserEvents.Deactivated())
                        .build());
            }
            return executor.push(context, model, events);
        });
    }

    /**
     * Applies the non-null fields of {@code change} that differ from the current state. A
     * password equal to the stored one is not a change.
     *
     * @throws CommandException {@code NOT_FOUND} if the user does not exist,
     *                          {@code PRECONDITION_FAILED} if nothing would change
     */
    public ObjectDetails changeHuman(CommandContext context, String userId, ChangeHuman change) {
        Objects.requireNonNull(change, "change");
        return executor.run("user.change-human", context, () -> {
            HumanWriteModel model = getExisting(context, userId);
            List<PendingEvent> events = new ArrayList<>();

            if (change.userName() != null && !change.userName().isBlank()
                    && !change.userName().equals(model.userName())) {
                events.add(nextEvent(context, model, events, UserEvents.USERNAME_CHANGED)
                        .payload(new UserEvents.UsernameChanged(change.userName()))
                        .build());
            }
            ChangeSet<UserEvents.ProfileChanged> profile = model.newProfileChangedEvent(change);
            if (profile.hasChanges()) {
                events.add(nextEvent(context, model, events, UserEvents.HUMAN_PROFILE_CHANGED)
                        .payload(profile.payload())
                        .build());
            }
            ChangeSet<UserEvents.EmailChanged> email = model.newEmailChangedEvent(change.email());
            if (email.hasChanges()) {
                events.add(nextEvent(context, model, events, UserEvents.HUMAN_EMAIL_CHANGED)
                        .payload(email.payload())
                        .build());
            }
            ChangeSet<UserEvents.PhoneChanged> phone = model.newPhoneChangedEvent(change.phone());
            if (phone.hasChanges()) {
                events.add(nextEvent(context, model, events, UserEvents.HUMAN_PHONE_CHANGED)
                        .payload(phone.payload())
                        .build());
            }
            if (change.password() != null && !change.password().isEmpty()
                    && passwordDiffers(model, change.password())) {
                events.add(nextEvent(context, model, events, UserEvents.HUMAN_PASSWORD_CHANGED)
                        .payload(new UserEvents.PasswordChanged(secrets.protect(change.password())))
                        .build());
            }
            for (MetadataEntry entry : model.changedMetadata(change.metadata())) {
                events.add(nextEvent(context, model, events, UserEvents.USER_METADATA_SET)
                        .payload(new UserEvents.MetadataSet(entry.key(), entry.value()))
                        .build());
            }
            for (String key : model.presentMetadataKeys(change.removedMetadataKeys())) {
                events.add(nextEvent(context, model, events, UserEvents.USER_METADATA_REMOVED)
                        .payload(new UserEvents.MetadataRemoved(key))
                        .build());
            }

            if (events.isEmpty()) {
                throw CommandException.noChanges("USER-NO-CHANGES");
            }
            return executor.push(context, model, events);
        });
    }

    /**
     * @throws CommandException {@code NOT_FOUND} if the user does not exist,
     *                          {@code PRECONDITION_FAILED} if it is already inactive
     */
    public ObjectDetails deactivateUser(CommandContext context, String userId) {
        return executor.run("user.deactivate", context, () -> {
            HumanWriteModel model = getExisting(context, userId);
            if (model.state() != UserState.ACTIVE) {
                throw CommandException.preconditionFailed("USER-NOT-ACTIVE", "Errors.User.NotActive");
            }
            return executor.push(context, model,
                    executor.newEvent(context, model, UserEvents.USER_DEACTIVATED)
                            .payload(new UserEvents.Deactivated())
                            .build());
        });
    }

    /**
     * @throws CommandException {@code NOT_FOUND} if the user does not exist,
     *                          {@code PRECONDITION_FAILED} if it is not inactive
     */
    public ObjectDetails reactivateUser(CommandContext context, String userId) {
        return executor.run("user.reactivate", context, () -> {
            HumanWriteModel model = getExisting(context, userId);
            if (model.state() != UserState.INACTIVE) {
                throw CommandException.preconditionFailed("USER-NOT-INACTIVE", "Errors.User.NotInactive");
            }
            return executor.push(context, model,
                    executor.newEvent(context, model, UserEvents.USER_REACTIVATED)
                            .payload(new UserEvents.Reactivated())
                            .build());
        });
    }

    /**
     * Removes the user and, in the same atomic append, every dependent membership and grant.
     *
     * <p>Appends {@code 1 + memberships + grants} events.
     *
     * @param dependents the dependents resolved for this user, see
     *                   {@link io.iamcore.cascade.CascadeResolver}
     * @throws CommandException {@code NOT_FOUND} if the user never existed or was removed
     */
    public ObjectDetails removeUser(CommandContext context, String userId, DependentReferences dependents) {
        Objects.requireNonNull(dependents, "dependents");
        return executor.run("user.remove", context, () -> {
            HumanWriteModel model = getExisting(context, userId);
            List<PendingEvent> events = new ArrayList<>(1 + dependents.size());
            events.add(executor.newEvent(context, model, UserEvents.USER_REMOVED)
                    .payload(new UserEvents.Removed(model.userName()))
                    .build());
            events.addAll(dependents.removalEvents(context, userId));
            return executor.push(context, model, events);
        });
    }

    /**
     * Returns the hydrated user in any state.
     */
    public HumanWriteModel getHuman(CommandContext context, String userId) {
        Objects.requireNonNull(userId, "userId");
        return executor.hydrate(context, new HumanWriteModel(userId, null));
    }

    private HumanWriteModel getExisting(CommandContext context, String userId) {
        if (userId == null || userId.isEmpty()) {
            throw CommandException.invalidArgument("USER-ID-EMPTY", "Errors.IDMissing");
        }
        HumanWriteModel model = getHuman(context, userId);
        if (!model.state().exists()) {
            throw CommandException.notFound("USER-NOT-FOUND", NOT_FOUND);
        }
        return model;
    }

    // A stored secret that can no longer be revealed, e.g. after a key change, counts as different.
    private boolean passwordDiffers(HumanWriteModel model, String proposed) {
        if (model.password() == null) {
            return true;
        }
        try {
            return !proposed.equals(secrets.reveal(model.password()));
        } catch (CommandException e) {
            if (e.kind() != ErrorKind.ENCRYPTION_ERROR) {
                throw e;
            }
            logger.log(Level.FINE, "Stored password of " + model.aggregate() + " cannot be revealed", e);
            return true;
        }
    }

    // Only the first event of a batch expects the aggregate head.
    private PendingEvent.Builder nextEvent(
            CommandContext context, HumanWriteModel model, List<PendingEvent> events, UserEvents type) {
        PendingEvent.Builder builder = executor.newEvent(context, model, type);
        if (!events.isEmpty()) {
            builder.expectedSequence(PendingEvent.ANY_SEQUENCE);
        }
        return builder;
    }

    private PendingEvent metadataSet(CommandContext context, HumanWriteModel model, MetadataEntry entry) {
        return executor.newEvent(context, model, UserEvents.USER_METADATA_SET)
                .expectedSequence(PendingEvent.ANY_SEQUENCE)
                .payload(new UserEvents.MetadataSet(entry.key(), entry.value()))
                .build();
    }

    private ProtectedSecret protect(String password) {
        if (password == null || password.isEmpty()) {
            return null;
        }
        return secrets.protect(password);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String newUserId() {
        return UlidCreator.getMonotonicUlid().toString().toLowerCase(Locale.ROOT);
    }
}
