package io.iamcore;

import java.util.Objects;

/**
 * Identifies one aggregate instance and therefore one ordered event stream.
 *
 * @param type          the aggregate type name
 * @param id            the aggregate identifier
 * @param resourceOwner the owning organization or instance; may be {@code null} when unknown
 *                      at read time
 */
public record AggregateRef(String type, String id, String resourceOwner) {

    public AggregateRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        if (type.isEmpty()) {
            throw new IllegalArgumentException("type cannot be empty");
        }
        if (id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }
    }

    public static AggregateRef of(AggregateType type, String id, String resourceOwner) {
        Objects.requireNonNull(type, "type");
        return new AggregateRef(type.name(), id, resourceOwner);
    }

    /**
     * Returns {@code true} if {@code other} addresses the same stream (type and id).
     * The resource owner is not part of the stream identity.
     */
    public boolean sameStream(AggregateRef other) {
        return other != null && type.equals(other.type) && id.equals(other.id);
    }

    @Override
    public String toString() {
        return type + "/" + id;
    }
}
