package io.iamcore;

import java.util.Objects;

/**
 * Thrown when a command or one of its collaborators fails.
 *
 * <p>Carries a {@link ErrorKind}, a stable {@code code} that identifies the throw site and a
 * message key for localized rendering (for example {@code Errors.SMTPConfig.NotFound}).
 */
public class CommandException extends RuntimeException {
    private final ErrorKind kind;
    private final String code;
    private final String messageKey;

    public CommandException(ErrorKind kind, String code, String messageKey) {
        this(kind, code, messageKey, null);
    }

    public CommandException(ErrorKind kind, String code, String messageKey, Throwable cause) {
        super(code + ": " + messageKey, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.code = Objects.requireNonNull(code, "code");
        this.messageKey = Objects.requireNonNull(messageKey, "messageKey");
    }

    public ErrorKind kind() {
        return kind;
    }

    public String code() {
        return code;
    }

    public String messageKey() {
        return messageKey;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public static CommandException alreadyExists(String code, String messageKey) {
        return new CommandException(ErrorKind.ALREADY_EXISTS, code, messageKey);
    }

    public static CommandException notFound(String code, String messageKey) {
        return new CommandException(ErrorKind.NOT_FOUND, code, messageKey);
    }

    public static CommandException preconditionFailed(String code, String messageKey) {
        return new CommandException(ErrorKind.PRECONDITION_FAILED, code, messageKey);
    }

    public static CommandException invalidArgument(String code, String messageKey) {
        return new CommandException(ErrorKind.INVALID_ARGUMENT, code, messageKey);
    }

    /**
     * The shared "nothing to change" failure raised by no-op suppression.
     */
    public static CommandException noChanges(String code) {
        return preconditionFailed(code, "Errors.NoChangesFound");
    }

    public static CommandException concurrencyConflict(String aggregate, long expected, long actual) {
        return new CommandException(ErrorKind.CONCURRENCY_CONFLICT, "EVENTLOG-CONFLICT",
                "Errors.Concurrency: " + aggregate + " expected sequence " + expected
                        + " but head is " + actual);
    }

    public static CommandException unavailable(String code, Throwable cause) {
        return new CommandException(ErrorKind.UNAVAILABLE, code, "Errors.Internal", cause);
    }

    public static CommandException serialization(String code, Throwable cause) {
        return new CommandException(ErrorKind.SERIALIZATION_ERROR, code, "Errors.Internal", cause);
    }

    public static CommandException encryption(String code, Throwable cause) {
        return new CommandException(ErrorKind.ENCRYPTION_ERROR, code, "Errors.Internal", cause);
    }

    public static CommandException cancelled(String code) {
        return new CommandException(ErrorKind.CANCELLED, code, "Errors.Cancelled");
    }
}
