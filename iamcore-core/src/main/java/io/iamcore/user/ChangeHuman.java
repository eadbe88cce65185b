package io.iamcore.user;

import java.util.List;

/**
 * Input of {@link UserCommands#changeHuman}. {@code null} fields are left unchanged.
 *
 * @param removedMetadataKeys metadata keys to delete; keys the user does not have are ignored
 */
public record ChangeHuman(
        String userName,
        String firstName,
        String lastName,
        String nickName,
        String displayName,
        String preferredLanguage,
        AddHuman.Email email,
        AddHuman.Phone phone,
        String password,
        List<MetadataEntry> metadata,
        List<String> removedMetadataKeys) {

    public ChangeHuman {
        metadata = metadata == null ? List.of() : List.copyOf(metadata);
        removedMetadataKeys = removedMetadataKeys == null ? List.of() : List.copyOf(removedMetadataKeys);
    }

    @Override
    public String toString() {
        return "ChangeHuman{userName=" + userName + "}";
    }
}
