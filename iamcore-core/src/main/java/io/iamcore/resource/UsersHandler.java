package io.iamcore.resource;

import io.iamcore.CommandContext;
import io.iamcore.CommandException;
import io.iamcore.ErrorKind;
import io.iamcore.ObjectDetails;
import io.iamcore.cascade.CascadeResolver;
import io.iamcore.cascade.DependentReferences;
import io.iamcore.resource.metadata.UserMetadataMapper;
import io.iamcore.spi.UserQuery;
import io.iamcore.spi.UserView;
import io.iamcore.user.AddHuman;
import io.iamcore.user.ChangeHuman;
import io.iamcore.user.HumanWriteModel;
import io.iamcore.user.MetadataEntry;
import io.iamcore.user.UserCommands;
import io.iamcore.user.UserState;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link ResourceHandler} provisioning human users.
 *
 * <p>Only the primary email and phone number are kept. Attributes without a native user
 * field are stored as metadata through {@link UserMetadataMapper}. Passwords are handed to
 * the commands and never returned.
 */
public final class UsersHandler implements ResourceHandler<UserResource> {
    static final String DEFAULT_LANGUAGE = "en";
    private static final String NO_CHANGES = "Errors.NoChangesFound";

    private final UserCommands commands;
    private final CascadeResolver cascades;
    private final UserQuery users;
    private final UserMetadataMapper metadata;
    private final UsersHandlerConfig config;

    public UsersHandler(
            UserCommands commands,
            CascadeResolver cascades,
            UserQuery users,
            UserMetadataMapper metadata,
            UsersHandlerConfig config) {
        this.commands = Objects.requireNonNull(commands, "commands");
        this.cascades = Objects.requireNonNull(cascades, "cascades");
        this.users = Objects.requireNonNull(users, "users");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String resourceNameSingular() {
        return "User";
    }

    @Override
    public String resourceNamePlural() {
        return "Users";
    }

    @Override
    public String schemaType() {
        return UserResource.SCHEMA;
    }

    @Override
    public UserResource create(CommandContext context, UserResource user) {
        Objects.requireNonNull(user, "user");
        AddHuman human = mapToAddHuman(user);
        ObjectDetails details = commands.addHuman(context, human);
        return user.toBuilder()
                .id(details.id())
                .password(null)
                .preferredLanguage(human.preferredLanguage())
                .active(!Boolean.FALSE.equals(user.active()))
                .meta(Resources.meta(this, config.baseUrl(), details))
                .build();
    }

    /**
     * Replaces the user's attributes. Metadata-backed attributes missing from {@code user} are
     * removed, while native attributes missing from it (user name, name parts, nick name,
     * display name, preferred language, email, phone, password) keep their current values.
     * The {@code active} flag deactivates or reactivates the user.
     */
    @Override
    public UserResource replace(CommandContext context, String id, UserResource user) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(user, "user");
        ObjectDetails details = null;
        try {
            details = commands.changeHuman(context, id, mapToChangeHuman(user));
        } catch (CommandException e) {
            if (e.kind() != ErrorKind.PRECONDITION_FAILED || !NO_CHANGES.equals(e.messageKey())) {
                throw e;
            }
        }
        if (user.active() != null) {
            HumanWriteModel current = commands.getHuman(context, id);
            if (user.active() && current.state() == UserState.INACTIVE) {
                details = commands.reactivateUser(context, id);
            } else if (!user.active() && current.state() == UserState.ACTIVE) {
                details = commands.deactivateUser(context, id);
            }
        }
        if (details == null) {
            return get(context, id);
        }
        return user.toBuilder()
                .id(id)
                .password(null)
                .meta(Resources.meta(this, config.baseUrl(), details))
                .build();
    }

    /**
     * Removes the user with all memberships and grants it holds.
     */
    @Override
    public void delete(CommandContext context, String id) {
        Objects.requireNonNull(id, "id");
        DependentReferences dependents = cascades.resolve(context, id);
        commands.removeUser(context, id, dependents);
    }

    @Override
    public UserResource get(CommandContext context, String id) {
        Objects.requireNonNull(id, "id");
        UserView view = users.findById(context, id)
                .orElseThrow(() -> CommandException.notFound("USER-NOT-FOUND", "Errors.User.NotFound"));
        return toResource(view);
    }

    @Override
    public ListResponse<UserResource> list(CommandContext context, ListRequest request) {
        Objects.requireNonNull(request, "request");
        UserQuery.UserSearchResult result = users.search(context, request.offset(), request.count());
        if (request.count() == 0) {
            return ListResponse.of(result.totalCount(), request, List.of());
        }
        List<UserResource> resources = new ArrayList<>(result.users().size());
        for (UserView view : result.users()) {
            resources.add(toResource(view));
        }
        return ListResponse.of(result.totalCount(), request, resources);
    }

    AddHuman mapToAddHuman(UserResource user) {
        UserResource.Name name = user.name();
        return new AddHuman(
                null,
                user.userName(),
                name == null ? null : name.givenName(),
                name == null ? null : name.familyName(),
                user.nickName(),
                displayName(user),
                preferredLanguage(user.preferredLanguage()),
                primaryEmail(user),
                primaryPhone(user),
                user.password(),
                metadata.toEntries(user),
                !Boolean.FALSE.equals(user.active()));
    }

    ChangeHuman mapToChangeHuman(UserResource user) {
        UserResource.Name name = user.name();
        List<MetadataEntry> entries = metadata.toEntries(user);
        return new ChangeHuman(
                user.userName(),
                name == null ? null : name.givenName(),
                name == null ? null : name.familyName(),
                user.nickName(),
                displayName(user),
                preferredLanguage(user.preferredLanguage()),
                primaryEmail(user),
                primaryPhone(user),
                user.password(),
                entries,
                metadata.unsetKeys(entries));
    }

    UserResource toResource(UserView view) {
        UserResource.Builder builder = UserResource.builder()
                .id(view.id())
                .userName(view.userName())
                .displayName(view.displayName())
                .nickName(view.nickName())
                .preferredLanguage(view.preferredLanguage())
                .active(view.active())
                .meta(new ResourceMeta(
                        resourceNameSingular(),
                        view.creationDate(),
                        view.changeDate(),
                        Long.toString(view.sequence()),
                        Resources.location(this, config.baseUrl(), view.id())));
        if (view.email() != null && !view.email().isEmpty()) {
            builder.emails(List.of(new UserResource.Email(view.email(), true)));
        }
        if (view.phone() != null && !view.phone().isEmpty()) {
            builder.phoneNumbers(List.of(new UserResource.PhoneNumber(view.phone(), true)));
        }
        UserResource.Name name = new UserResource.Name(
                view.displayName(), view.lastName(), view.firstName(), null, null, null);
        return metadata.restore(builder, name, view.metadata()).build();
    }

    // Direct display name wins over the formatted name.
    private static String displayName(UserResource user) {
        if (user.displayName() != null && !user.displayName().isEmpty()) {
            return user.displayName();
        }
        return user.name() == null ? null : user.name().formatted();
    }

    private AddHuman.Email primaryEmail(UserResource user) {
        for (UserResource.Email email : user.emails()) {
            if (email.primary()) {
                return new AddHuman.Email(email.value(), config.emailVerified());
            }
        }
        return null;
    }

    private AddHuman.Phone primaryPhone(UserResource user) {
        for (UserResource.PhoneNumber phone : user.phoneNumbers()) {
            if (phone.primary()) {
                return new AddHuman.Phone(phone.value(), config.phoneVerified());
            }
        }
        return null;
    }

    static String preferredLanguage(String tag) {
        if (tag == null || tag.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        Locale locale = Locale.forLanguageTag(tag);
        if (locale.getLanguage().isEmpty()) {
            return DEFAULT_LANGUAGE;
        }
        return locale.toLanguageTag();
    }
}
