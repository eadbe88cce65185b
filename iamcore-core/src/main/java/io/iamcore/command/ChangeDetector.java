package io.iamcore.command;

import java.util.Objects;

/**
 * Field-by-field comparison of current and proposed state.
 *
 * <p>Write models use one detector per delta payload:
 * <pre>{@code
 * ChangeDetector changes = new ChangeDetector();
 * String host = changes.diff(this.host, proposed.host());
 * ...
 * return new ChangeSet<>(new Changed(host, ...), changes.hasChanges());
 * }</pre>
 *
 * <p>Not thread-safe; create one per comparison.
 */
public final class ChangeDetector {
    private int changedFields;

    /**
     * Returns {@code proposed} if it differs from {@code current}, otherwise {@code null}.
     *
     * <p>A {@code null} proposal means "leave unchanged" and never counts as a change.
     */
    public <T> T diff(T current, T proposed) {
        if (proposed == null || Objects.equals(current, proposed)) {
            return null;
        }
        changedFields++;
        return proposed;
    }

    /**
     * Like {@link #diff} but always reports a change, for fields whose value cannot be
     * compared (protected secrets).
     */
    public <T> T always(T proposed) {
        if (proposed == null) {
            return null;
        }
        changedFields++;
        return proposed;
    }

    public boolean hasChanges() {
        return changedFields > 0;
    }

    public int changedFields() {
        return changedFields;
    }
}
