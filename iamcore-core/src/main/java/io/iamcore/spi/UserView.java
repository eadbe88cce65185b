package io.iamcore.spi;

import java.time.Instant;
import java.util.Map;

/**
 * Read-side snapshot of a human user.
 *
 * @param sequence     the aggregate head the snapshot reflects
 * @param metadata     all metadata of the user by key
 */
public record UserView(
        String id,
        String resourceOwner,
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
        boolean active,
        Map<String, String> metadata,
        long sequence,
        Instant creationDate,
        Instant changeDate) {

    public UserView {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
