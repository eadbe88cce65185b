package io.iamcore.command;

import io.iamcore.EventPayload;

/**
 * A delta payload together with whether it carries any change.
 *
 * @param payload    the delta, unchanged fields left {@code null}
 * @param hasChanges {@code false} when the proposed state equals the current one
 */
public record ChangeSet<P extends EventPayload>(P payload, boolean hasChanges) {
}
