package io.iamcore;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Acting user and tenant for one command or query invocation.
 *
 * <p>Passed explicitly to every command, query and collaborator call. Carries a cooperative
 * cancellation flag and an optional deadline; long-running steps call {@link #checkActive()}
 * at each I/O boundary.
 *
 * <p>A context is used by one invocation at a time, but {@link #cancel()} may be called from
 * any thread.
 */
public final class CommandContext {
    private final String editorUser;
    private final String instanceId;
    private final String resourceOwner;
    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancelled;

    private CommandContext(Builder builder) {
        this.editorUser = Objects.requireNonNull(builder.editorUser, "editorUser");
        this.instanceId = Objects.requireNonNull(builder.instanceId, "instanceId");
        this.resourceOwner = builder.resourceOwner == null ? builder.instanceId : builder.resourceOwner;
        this.deadline = builder.deadline;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a context without deadline whose resource owner is the instance.
     */
    public static CommandContext of(String editorUser, String instanceId) {
        return builder().editorUser(editorUser).instanceId(instanceId).build();
    }

    public String editorUser() {
        return editorUser;
    }

    public String instanceId() {
        return instanceId;
    }

    /**
     * The organization (or instance) new aggregates are owned by.
     */
    public String resourceOwner() {
        return resourceOwner;
    }

    /**
     * Returns the deadline, or {@code null} when the invocation is unbounded.
     */
    public Instant deadline() {
        return deadline;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * Throws {@link ErrorKind#CANCELLED} if the invocation was cancelled or its deadline passed.
     */
    public void checkActive() {
        if (isCancelled()) {
            throw CommandException.cancelled("CTX-CANCELLED");
        }
    }

    /**
     * Returns a copy acting on behalf of another resource owner.
     */
    public CommandContext withResourceOwner(String resourceOwner) {
        return builder()
                .editorUser(editorUser)
                .instanceId(instanceId)
                .resourceOwner(resourceOwner)
                .deadline(deadline)
                .clock(clock)
                .build();
    }

    @Override
    public String toString() {
        return "CommandContext{editorUser=" + editorUser
                + ", instanceId=" + instanceId
                + ", resourceOwner=" + resourceOwner + '}';
    }

    public static final class Builder {
        private String editorUser;
        private String instanceId;
        private String resourceOwner;
        private Instant deadline;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder editorUser(String editorUser) {
            this.editorUser = editorUser;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        /**
         * Optional. Defaults to the instance id.
         */
        public Builder resourceOwner(String resourceOwner) {
            this.resourceOwner = resourceOwner;
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public CommandContext build() {
            return new CommandContext(this);
        }
    }
}
