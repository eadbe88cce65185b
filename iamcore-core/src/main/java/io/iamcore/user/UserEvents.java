package io.iamcore.user;

import io.iamcore.AggregateType;
import io.iamcore.EventPayload;
import io.iamcore.EventType;
import io.iamcore.IamAggregates;
import io.iamcore.ProtectedSecret;

/**
 * Events of the user aggregate.
 */
public enum UserEvents implements EventType {
    HUMAN_ADDED(HumanAdded.class),
    HUMAN_PROFILE_CHANGED(ProfileChanged.class),
    HUMAN_EMAIL_CHANGED(EmailChanged.class),
    HUMAN_PHONE_CHANGED(PhoneChanged.class),
    HUMAN_PASSWORD_CHANGED(PasswordChanged.class),
    USERNAME_CHANGED(UsernameChanged.class),
    USER_DEACTIVATED(Deactivated.class),
    USER_REACTIVATED(Reactivated.class),
    USER_REMOVED(Removed.class),
    USER_METADATA_SET(MetadataSet.class),
    USER_METADATA_REMOVED(MetadataRemoved.class);

    private final Class<? extends EventPayload> payloadType;

    UserEvents(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    @Override
    public AggregateType aggregateType() {
        return IamAggregates.USER;
    }

    @Override
    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public record HumanAdded(
            String userName,
            String firstName,
            String lastName,
            String nickName,
            String displayName,
            String preferredLanguage,
            String email,
            boolean emailVerified,
            String phone,
            boolean phoneVerified,
            ProtectedSecret password) implements EventPayload {
    }

    /**
     * Profile delta; {@code null} means unchanged.
     */
    public record ProfileChanged(
            String firstName,
            String lastName,
            String nickName,
            String displayName,
            String preferredLanguage) implements EventPayload {
    }

    public record EmailChanged(String email, Boolean verified) implements EventPayload {
    }

    public record PhoneChanged(String phone, Boolean verified) implements EventPayload {
    }

    public record PasswordChanged(ProtectedSecret password) implements EventPayload {
    }

    public record UsernameChanged(String userName) implements EventPayload {
    }

    public record Deactivated() implements EventPayload {
    }

    public record Reactivated() implements EventPayload {
    }

    public record Removed(String userName) implements EventPayload {
    }

    public record MetadataSet(String key, String value) implements EventPayload {
    }

    public record MetadataRemoved(String key) implements EventPayload {
    }
}
