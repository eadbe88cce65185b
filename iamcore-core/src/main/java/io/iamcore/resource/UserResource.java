package io.iamcore.resource;

import java.net.URI;
import java.util.List;

/**
 * A provisioned user with its SCIM core and enterprise attributes.
 *
 * <p>Attributes without a native user field are kept as user metadata, see
 * {@link io.iamcore.resource.metadata.MetadataKey}.
 */
public record UserResource(
        String id,
        String externalId,
        String userName,
        Name name,
        String displayName,
        String nickName,
        URI profileUrl,
        String title,
        String preferredLanguage,
        String locale,
        String timezone,
        Boolean active,
        List<Email> emails,
        List<PhoneNumber> phoneNumbers,
        String password,
        List<Ims> ims,
        List<Address> addresses,
        List<Photo> photos,
        List<Entitlement> entitlements,
        List<Role> roles,
        ResourceMeta meta) implements Resource {

    public static final String SCHEMA = "urn:ietf:params:scim:schemas:core:2.0:User";

    public UserResource {
        emails = copy(emails);
        phoneNumbers = copy(phoneNumbers);
        ims = copy(ims);
        addresses = copy(addresses);
        photos = copy(photos);
        entitlements = copy(entitlements);
        roles = copy(roles);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .externalId(externalId)
                .userName(userName)
                .name(name)
                .displayName(displayName)
                .nickName(nickName)
                .profileUrl(profileUrl)
                .title(title)
                .preferredLanguage(preferredLanguage)
                .locale(locale)
                .timezone(timezone)
                .active(active)
                .emails(emails)
                .phoneNumbers(phoneNumbers)
                .password(password)
                .ims(ims)
                .addresses(addresses)
                .photos(photos)
                .entitlements(entitlements)
                .roles(roles)
                .meta(meta);
    }

    @Override
    public String toString() {
        return "UserResource{id=" + id + ", userName=" + userName + "}";
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    public record Name(
            String formatted,
            String familyName,
            String givenName,
            String middleName,
            String honorificPrefix,
            String honorificSuffix) {
    }

    public record Email(String value, boolean primary) {
    }

    public record PhoneNumber(String value, boolean primary) {
    }

    public record Ims(String value, String type) {
    }

    public record Address(
            String type,
            String streetAddress,
            String locality,
            String region,
            String postalCode,
            String country,
            String formatted,
            boolean primary) {
    }

    public record Photo(String value, String display, String type, boolean primary) {
    }

    public record Entitlement(String value, String display, String type, boolean primary) {
    }

    public record Role(String value, String display, String type, boolean primary) {
    }

    public static final class Builder {
        private String id;
        private String externalId;
        private String userName;
        private Name name;
        private String displayName;
        private String nickName;
        private URI profileUrl;
        private String title;
        private String preferredLanguage;
        private String locale;
        private String timezone;
        private Boolean active;
        private List<Email> emails;
        private List<PhoneNumber> phoneNumbers;
        private String password;
        private List<Ims> ims;
        private List<Address> addresses;
        private List<Photo> photos;
        private List<Entitlement> entitlements;
        private List<Role> roles;
        private ResourceMeta meta;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder userName(String userName) {
            this.userName = userName;
            return this;
        }

        public Builder name(Name name) {
            this.name = name;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder nickName(String nickName) {
            this.nickName = nickName;
            return this;
        }

        public Builder profileUrl(URI profileUrl) {
            this.profileUrl = profileUrl;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder preferredLanguage(String preferredLanguage) {
            this.preferredLanguage = preferredLanguage;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder active(Boolean active) {
            this.active = active;
            return this;
        }

        public Builder emails(List<Email> emails) {
            this.emails = emails;
            return this;
        }

        public Builder phoneNumbers(List<PhoneNumber> phoneNumbers) {
            this.phoneNumbers = phoneNumbers;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder ims(List<Ims> ims) {
            this.ims = ims;
            return this;
        }

        public Builder addresses(List<Address> addresses) {
            this.addresses = addresses;
            return this;
        }

        public Builder photos(List<Photo> photos) {
            this.photos = photos;
            return this;
        }

        public Builder entitlements(List<Entitlement> entitlements) {
            this.entitlements = entitlements;
            return this;
        }

        public Builder roles(List<Role> roles) {
            this.roles = roles;
            return this;
        }

        public Builder meta(ResourceMeta meta) {
            this.meta = meta;
            return this;
        }

        public UserResource build() {
            return new UserResource(id, externalId, userName, name, displayName, nickName, profileUrl, title,
                    preferredLanguage, locale, timezone, active, emails, phoneNumbers, password, ims, addresses,
                    photos, entitlements, roles, meta);
        }
    }
}
