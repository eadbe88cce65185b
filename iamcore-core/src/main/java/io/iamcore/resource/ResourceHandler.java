package io.iamcore.resource;

import io.iamcore.CommandContext;

/**
 * Create, replace, delete, get and list for one resource type.
 *
 * <p>Protocol adapters route requests to handlers by {@link #resourceNamePlural()}. Handlers
 * translate resources into commands and queries and stay free of wire formats.
 *
 * @param <T> the resource type
 * @see UsersHandler
 */
public interface ResourceHandler<T extends Resource> {

    /**
     * Singular resource type name, e.g. {@code User}.
     */
    String resourceNameSingular();

    /**
     * Plural resource type name used in locations, e.g. {@code Users}.
     */
    String resourceNamePlural();

    /**
     * Schema URN of the resource.
     */
    String schemaType();

    /**
     * Creates the resource.
     *
     * @return the stored resource with id and meta set
     */
    T create(CommandContext context, T resource);

    /**
     * Replaces the resource's attributes.
     *
     * @throws io.iamcore.CommandException {@code NOT_FOUND} if it does not exist
     */
    T replace(CommandContext context, String id, T resource);

    /**
     * @throws io.iamcore.CommandException {@code NOT_FOUND} if it does not exist
     */
    void delete(CommandContext context, String id);

    /**
     * @throws io.iamcore.CommandException {@code NOT_FOUND} if it does not exist
     */
    T get(CommandContext context, String id);

    ListResponse<T> list(CommandContext context, ListRequest request);
}
