package io.iamcore;

/**
 * Classification of command failures.
 *
 * <p>Protocol adapters map each kind to a status of their own (for example
 * {@link #NOT_FOUND} to HTTP 404).
 */
public enum ErrorKind {
    ALREADY_EXISTS(false),
    NOT_FOUND(false),
    PRECONDITION_FAILED(false),
    INVALID_ARGUMENT(false),
    /** The aggregate head moved between hydration and append. Re-run the command. */
    CONCURRENCY_CONFLICT(true),
    ENCRYPTION_ERROR(false),
    SERIALIZATION_ERROR(false),
    /** The event log or a dependent query could not be reached. */
    UNAVAILABLE(true),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Returns whether re-running the same command may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
