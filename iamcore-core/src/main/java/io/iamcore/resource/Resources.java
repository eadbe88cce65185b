package io.iamcore.resource;

import io.iamcore.ObjectDetails;

import java.time.Instant;

/**
 * Helpers shared by resource handlers.
 */
public final class Resources {
    private Resources() {
    }

    /**
     * Builds resource metadata from a command result. A missing creation date falls back to
     * the event date.
     */
    public static ResourceMeta meta(ResourceHandler<?> handler, String baseUrl, ObjectDetails details) {
        Instant created = details.creationDate() != null ? details.creationDate() : details.eventDate();
        return new ResourceMeta(
                handler.resourceNameSingular(),
                created,
                details.eventDate(),
                details.version(),
                location(handler, baseUrl, details.id()));
    }

    public static String location(ResourceHandler<?> handler, String baseUrl, String id) {
        return baseUrl + "/" + handler.resourceNamePlural() + "/" + id;
    }
}
