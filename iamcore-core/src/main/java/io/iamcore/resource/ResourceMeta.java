package io.iamcore.resource;

import java.time.Instant;

/**
 * Bookkeeping attributes of a resource.
 *
 * @param resourceType the singular resource type name, e.g. {@code User}
 * @param created      creation time
 * @param lastModified time of the last change
 * @param version      the aggregate sequence as decimal string
 * @param location     absolute URL of the resource
 */
public record ResourceMeta(
        String resourceType,
        Instant created,
        Instant lastModified,
        String version,
        String location) {
}
