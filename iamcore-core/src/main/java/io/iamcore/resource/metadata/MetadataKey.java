package io.iamcore.resource.metadata;

import java.util.Optional;

/**
 * User attributes without a native field, stored as scoped user metadata.
 *
 * <p>The set is closed: code that extracts or restores values switches over every constant.
 */
public enum MetadataKey {
    EXTERNAL_ID("externalId"),
    MIDDLE_NAME("name.middleName"),
    HONORIFIC_PREFIX("name.honorificPrefix"),
    HONORIFIC_SUFFIX("name.honorificSuffix"),
    PROFILE_URL("profileUrl"),
    TITLE("title"),
    LOCALE("locale"),
    TIMEZONE("timezone"),
    IMS("ims"),
    PHOTOS("photos"),
    ADDRESSES("addresses"),
    ENTITLEMENTS("entitlements"),
    ROLES("roles");

    public static final String PREFIX = "urn:iamcore:scim:";

    private final String attribute;

    MetadataKey(String attribute) {
        this.attribute = attribute;
    }

    /**
     * Returns the attribute path, e.g. {@code name.middleName}.
     */
    public String attribute() {
        return attribute;
    }

    /**
     * Returns the metadata key the value is stored under.
     */
    public String scopedKey() {
        return PREFIX + attribute;
    }

    public static Optional<MetadataKey> fromScopedKey(String scopedKey) {
        if (scopedKey == null || !scopedKey.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String attribute = scopedKey.substring(PREFIX.length());
        for (MetadataKey key : values()) {
            if (key.attribute.equals(attribute)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
