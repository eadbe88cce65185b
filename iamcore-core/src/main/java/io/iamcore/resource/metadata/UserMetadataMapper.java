package io.iamcore.resource.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.iamcore.CommandException;
import io.iamcore.codec.JacksonEventCodec;
import io.iamcore.resource.UserResource;
import io.iamcore.user.MetadataEntry;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves user attributes without a native field into metadata entries and back.
 *
 * <p>Values that cannot be written or read are logged and skipped, so one malformed attribute
 * never fails a whole user.
 */
public final class UserMetadataMapper {
    private static final Logger logger = Logger.getLogger(UserMetadataMapper.class.getName());

    private final ObjectMapper mapper;

    public UserMetadataMapper() {
        this(JacksonEventCodec.defaultMapper());
    }

    public UserMetadataMapper(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns one entry per key with a non-empty value, keyed by {@link MetadataKey#scopedKey()}.
     */
    public List<MetadataEntry> toEntries(UserResource user) {
        Objects.requireNonNull(user, "user");
        List<MetadataEntry> entries = new ArrayList<>();
        for (MetadataKey key : MetadataKey.values()) {
            MetadataValue value = valueOf(user, key);
            if (value == null) {
                continue;
            }
            String serialized;
            try {
                serialized = value.serialize(mapper);
            } catch (CommandException e) {
                logger.log(Level.WARNING, "Failed to serialize user metadata " + key.scopedKey(), e);
                continue;
            }
            if (!serialized.isEmpty()) {
                entries.add(new MetadataEntry(key.scopedKey(), serialized));
            }
        }
        return entries;
    }

    /**
     * Returns the scoped keys managed by this mapper that {@code entries} leaves unset.
     */
    public List<String> unsetKeys(List<MetadataEntry> entries) {
        List<String> unset = new ArrayList<>();
        for (MetadataKey key : MetadataKey.values()) {
            boolean present = false;
            for (MetadataEntry entry : entries) {
                if (entry.key().equals(key.scopedKey())) {
                    present = true;
                    break;
                }
            }
            if (!present) {
                unset.add(key.scopedKey());
            }
        }
        return unset;
    }

    static MetadataValue valueOf(UserResource user, MetadataKey key) {
        UserResource.Name name = user.name();
        return switch (key) {
            case EXTERNAL_ID -> scalar(user.externalId());
            case MIDDLE_NAME -> name == null ? null : scalar(name.middleName());
            case HONORIFIC_PREFIX -> name == null ? null : scalar(name.honorificPrefix());
            case HONORIFIC_SUFFIX -> name == null ? null : scalar(name.honorificSuffix());
            case PROFILE_URL -> user.profileUrl() == null ? null : new MetadataValue.Url(user.profileUrl());
            case TITLE -> scalar(user.title());
            case LOCALE -> scalar(user.locale());
            case TIMEZONE -> scalar(user.timezone());
            case IMS -> new MetadataValue.Structured(user.ims());
            case PHOTOS -> new MetadataValue.Structured(user.photos());
            case ADDRESSES -> new MetadataValue.Structured(user.addresses());
            case ENTITLEMENTS -> new MetadataValue.Structured(user.entitlements());
            case ROLES -> new MetadataValue.Structured(user.roles());
        };
    }

    /**
     * Restores the metadata-backed attributes onto {@code builder}. The name's metadata parts
     * are merged into {@code name}.
     *
     * @param metadata all metadata of the user by scoped key
     * @param name     the name built from native fields
     */
    public UserResource.Builder restore(UserResource.Builder builder, UserResource.Name name, Map<String, String> metadata) {
        Objects.requireNonNull(builder, "builder");
        Objects.requireNonNull(metadata, "metadata");
        String middleName = null;
        String honorificPrefix = null;
        String honorificSuffix = null;
        for (MetadataKey key : MetadataKey.values()) {
            String raw = metadata.get(key.scopedKey());
            if (raw == null) {
                continue;
            }
            switch (key) {
                case EXTERNAL_ID -> builder.externalId(raw);
                case MIDDLE_NAME -> middleName = raw;
                case HONORIFIC_PREFIX -> honorificPrefix = raw;
                case HONORIFIC_SUFFIX -> honorificSuffix = raw;
                case PROFILE_URL -> builder.profileUrl(parseUrl(key, raw));
                case TITLE -> builder.title(raw);
                case LOCALE -> builder.locale(raw);
                case TIMEZONE -> builder.timezone(raw);
                case IMS -> builder.ims(readList(key, raw, new TypeReference<List<UserResource.Ims>>() { }));
                case PHOTOS -> builder.photos(readList(key, raw, new TypeReference<List<UserResource.Photo>>() { }));
                case ADDRESSES -> builder.addresses(
                        readList(key, raw, new TypeReference<List<UserResource.Address>>() { }));
                case ENTITLEMENTS -> builder.entitlements(
                        readList(key, raw, new TypeReference<List<UserResource.Entitlement>>() { }));
                case ROLES -> builder.roles(readList(key, raw, new TypeReference<List<UserResource.Role>>() { }));
            }
        }
        if (name != null || middleName != null || honorificPrefix != null || honorificSuffix != null) {
            UserResource.Name base = name != null ? name : new UserResource.Name(null, null, null, null, null, null);
            builder.name(new UserResource.Name(
                    base.formatted(),
                    base.familyName(),
                    base.givenName(),
                    middleName,
                    honorificPrefix,
                    honorificSuffix));
        }
        return builder;
    }

    private <T> List<T> readList(MetadataKey key, String raw, TypeReference<List<T>> type) {
        try {
            return mapper.readValue(raw, type);
        } catch (JsonProcessingException e) {
            logger.log(Level.WARNING, "Could not deserialize user metadata " + key.scopedKey(), e);
            return List.of();
        }
    }

    private static URI parseUrl(MetadataKey key, String raw) {
        try {
            URI uri = new URI(raw);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new URISyntaxException(raw, "not an http(s) URL");
            }
            return uri;
        } catch (URISyntaxException e) {
            logger.log(Level.WARNING, "Failed to parse user metadata url " + key.scopedKey(), e);
            return null;
        }
    }

    private static MetadataValue scalar(String value) {
        return value == null || value.isEmpty() ? null : new MetadataValue.Scalar(value);
    }
}
