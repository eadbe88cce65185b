package io.iamcore.user;

import io.iamcore.AggregateRef;
import io.iamcore.Event;
import io.iamcore.IamAggregates;
import io.iamcore.ProtectedSecret;
import io.iamcore.command.ChangeDetector;
import io.iamcore.command.ChangeSet;
import io.iamcore.writemodel.WriteModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A human user folded from the user stream, metadata included.
 */
public final class HumanWriteModel extends WriteModel {
    private UserState state = UserState.UNSPECIFIED;
    private String userName;
    private String firstName;
    private String lastName;
    private String nickName;
    private String displayName;
    private String preferredLanguage;
    private String email;
    private boolean emailVerified;
    private String phone;
    private boolean phoneVerified;
    private ProtectedSecret password;
    private final Map<String, String> metadata = new TreeMap<>();

    /**
     * @param userId        the user id
     * @param resourceOwner the owner for new users, {@code null} for lookups
     */
    public HumanWriteModel(String userId, String resourceOwner) {
        super(AggregateRef.of(IamAggregates.USER, userId, resourceOwner));
    }

    @Override
    protected void reduce(Event event) {
        if (!(event.type() instanceof UserEvents)) {
            return;
        }
        switch ((UserEvents) event.type()) {
            case HUMAN_ADDED -> {
                UserEvents.HumanAdded added = event.payload(UserEvents.HumanAdded.class);
                state = UserState.ACTIVE;
                userName = added.userName();
                firstName = added.firstName();
                lastName = added.lastName();
                nickName = added.nickName();
                displayName = added.displayName();
                preferredLanguage = added.preferredLanguage();
                email = added.email();
                emailVerified = added.emailVerified();
                phone = added.phone();
                phoneVerified = added.phoneVerified();
                password = added.password();
            }
            case HUMAN_PROFILE_CHANGED -> {
                UserEvents.ProfileChanged changed = event.payload(UserEvents.ProfileChanged.class);
                firstName = changed.firstName() != null ? changed.firstName() : firstName;
                lastName = changed.lastName() != null ? changed.lastName() : lastName;
                nickName = changed.nickName() != null ? changed.nickName() : nickName;
                displayName = changed.displayName() != null ? changed.displayName() : displayName;
                preferredLanguage = changed.preferredLanguage() != null
                        ? changed.preferredLanguage() : preferredLanguage;
            }
            case HUMAN_EMAIL_CHANGED -> {
                UserEvents.EmailChanged changed = event.payload(UserEvents.EmailChanged.class);
                if (changed.email() != null) {
                    email = changed.email();
                }
                if (changed.verified() != null) {
                    emailVerified = changed.verified();
                }
            }
            case HUMAN_PHONE_CHANGED -> {
                UserEvents.PhoneChanged changed = event.payload(UserEvents.PhoneChanged.class);
                if (changed.phone() != null) {
                    phone = changed.phone();
                }
                if (changed.verified() != null) {
                    phoneVerified = changed.verified();
                }
            }
            case HUMAN_PASSWORD_CHANGED -> password = event.payload(UserEvents.PasswordChanged.class).password();
            case USERNAME_CHANGED -> userName = event.payload(UserEvents.UsernameChanged.class).userName();
            case USER_DEACTIVATED -> state = UserState.INACTIVE;
            case USER_REACTIVATED -> state = UserState.ACTIVE;
            case USER_REMOVED -> {
                state = UserState.REMOVED;
                metadata.clear();
                password = null;
            }
            case USER_METADATA_SET -> {
                UserEvents.MetadataSet set = event.payload(UserEvents.MetadataSet.class);
                metadata.put(set.key(), set.value());
            }
            case USER_METADATA_REMOVED -> metadata.remove(event.payload(UserEvents.MetadataRemoved.class).key());
        }
    }

    public ChangeSet<UserEvents.ProfileChanged> newProfileChangedEvent(ChangeHuman change) {
        ChangeDetector changes = new ChangeDetector();
        UserEvents.ProfileChanged payload = new UserEvents.ProfileChanged(
                changes.diff(firstName, change.firstName()),
                changes.diff(lastName, change.lastName()),
                changes.diff(nickName, change.nickName()),
                changes.diff(displayName, change.displayName()),
                changes.diff(preferredLanguage, change.preferredLanguage()));
        return new ChangeSet<>(payload, changes.hasChanges());
    }

    public ChangeSet<UserEvents.EmailChanged> newEmailChangedEvent(AddHuman.Email proposed) {
        if (proposed == null) {
            return new ChangeSet<>(new UserEvents.EmailChanged(null, null), false);
        }
        ChangeDetector changes = new ChangeDetector();
        UserEvents.EmailChanged payload = new UserEvents.EmailChanged(
                changes.diff(email, proposed.address()),
                changes.diff(emailVerified, proposed.verified()));
        return new ChangeSet<>(payload, changes.hasChanges());
    }

    public ChangeSet<UserEvents.PhoneChanged> newPhoneChangedEvent(AddHuman.Phone proposed) {
        if (proposed == null) {
            return new ChangeSet<>(new UserEvents.PhoneChanged(null, null), false);
        }
        ChangeDetector changes = new ChangeDetector();
        UserEvents.PhoneChanged payload = new UserEvents.PhoneChanged(
                changes.diff(phone, proposed.number()),
                changes.diff(phoneVerified, proposed.verified()));
        return new ChangeSet<>(payload, changes.hasChanges());
    }

    /**
     * Returns the metadata entries whose value differs from the stored one. Empty values are
     * skipped.
     */
    public List<MetadataEntry> changedMetadata(List<MetadataEntry> proposed) {
        List<MetadataEntry> changed = new ArrayList<>();
        for (MetadataEntry entry : proposed) {
            if (!entry.value().isEmpty() && !entry.value().equals(metadata.get(entry.key()))) {
                changed.add(entry);
            }
        }
        return changed;
    }

    /**
     * Returns the keys among {@code keys} that are currently set.
     */
    public List<String> presentMetadataKeys(List<String> keys) {
        List<String> present = new ArrayList<>();
        for (String key : keys) {
            if (metadata.containsKey(key) && !present.contains(key)) {
                present.add(key);
            }
        }
        return present;
    }

    public UserState state() {
        return state;
    }

    public String userName() {
        return userName;
    }

    public String firstName() {
        return firstName;
    }

    public String lastName() {
        return lastName;
    }

    public String nickName() {
        return nickName;
    }

    public String displayName() {
        return displayName;
    }

    public String preferredLanguage() {
        return preferredLanguage;
    }

    public String email() {
        return email;
    }

    public boolean emailVerified() {
        return emailVerified;
    }

    public String phone() {
        return phone;
    }

    public boolean phoneVerified() {
        return phoneVerified;
    }

    public ProtectedSecret password() {
        return password;
    }

    public Map<String, String> metadata() {
        return Collections.unmodifiableMap(metadata);
    }
}
