package io.iamcore.resource;

/**
 * A provisioned resource exposed through a {@link ResourceHandler}.
 */
public interface Resource {

    /**
     * Returns the resource id, {@code null} before creation.
     */
    String id();

    /**
     * Returns the resource metadata, {@code null} before creation.
     */
    ResourceMeta meta();
}
