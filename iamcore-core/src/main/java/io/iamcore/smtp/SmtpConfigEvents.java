package io.iamcore.smtp;

import io.iamcore.AggregateType;
import io.iamcore.EventPayload;
import io.iamcore.EventType;
import io.iamcore.IamAggregates;
import io.iamcore.ProtectedSecret;

/**
 * SMTP configuration events, stored on the instance aggregate.
 */
public enum SmtpConfigEvents implements EventType {
    SMTP_CONFIG_ADDED(Added.class),
    SMTP_CONFIG_CHANGED(Changed.class),
    SMTP_CONFIG_PASSWORD_CHANGED(PasswordChanged.class),
    SMTP_CONFIG_REMOVED(Removed.class);

    private final Class<? extends EventPayload> payloadType;

    SmtpConfigEvents(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    @Override
    public AggregateType aggregateType() {
        return IamAggregates.INSTANCE;
    }

    @Override
    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    /**
     * @param password {@code null} when no password was configured
     */
    public record Added(
            boolean tls,
            String senderAddress,
            String senderName,
            String host,
            String user,
            ProtectedSecret password) implements EventPayload {
    }

    /**
     * Delta of the non-secret fields; {@code null} means unchanged.
     */
    public record Changed(
            Boolean tls,
            String senderAddress,
            String senderName,
            String host,
            String user) implements EventPayload {
    }

    public record PasswordChanged(ProtectedSecret password) implements EventPayload {
    }

    public record Removed() implements EventPayload {
    }
}
