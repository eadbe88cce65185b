package io.iamcore.user;

public enum UserState {
    UNSPECIFIED,
    ACTIVE,
    INACTIVE,
    REMOVED;

    /**
     * Returns whether the user exists and has not been removed.
     */
    public boolean exists() {
        return this == ACTIVE || this == INACTIVE;
    }
}
