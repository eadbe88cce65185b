package io.iamcore.user;

import java.util.Objects;

/**
 * One user metadata key/value pair.
 */
public record MetadataEntry(String key, String value) {

    public MetadataEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be empty");
        }
    }
}
