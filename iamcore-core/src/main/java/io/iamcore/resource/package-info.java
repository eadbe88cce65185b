/**
 * Provisioning resources on top of the command core.
 *
 * <p>A {@link io.iamcore.resource.ResourceHandler} maps one resource type onto commands and
 * read-side queries. Wire formats and routing belong to the protocol adapter in front.
 */
package io.iamcore.resource;
