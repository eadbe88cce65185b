package io.iamcore.user;

import java.util.List;

/**
 * Input of {@link UserCommands#addHuman}.
 *
 * @param userId            the id to use, or {@code null} to generate one
 * @param userName          the login name, required
 * @param firstName         given name
 * @param lastName          family name
 * @param nickName          nick name
 * @param displayName       display name
 * @param preferredLanguage BCP 47 language tag
 * @param email             primary email, may be {@code null}
 * @param phone             primary phone, may be {@code null}
 * @param password          initial plaintext password, may be {@code null}
 * @param metadata          metadata stored with the user; entries with empty values are skipped
 * @param active            {@code false} creates the user already deactivated
 */
public record AddHuman(
        String userId,
        String userName,
        String firstName,
        String lastName,
        String nickName,
        String displayName,
        String preferredLanguage,
        Email email,
        Phone phone,
        String password,
        List<MetadataEntry> metadata,
        boolean active) {

    public AddHuman {
        metadata = metadata == null ? List.of() : List.copyOf(metadata);
    }

    /**
     * Creates the input for an active user.
     */
    public AddHuman(
            String userId,
            String userName,
            String firstName,
            String lastName,
            String nickName,
            String displayName,
            String preferredLanguage,
            Email email,
            Phone phone,
            String password,
            List<MetadataEntry> metadata) {
        this(userId, userName, firstName, lastName, nickName, displayName, preferredLanguage,
                email, phone, password, metadata, true);
    }

    public record Email(String address, boolean verified) {
    }

    public record Phone(String number, boolean verified) {
    }

    @Override
    public String toString() {
        return "AddHuman{userId=" + userId + ", userName=" + userName + "}";
    }
}
