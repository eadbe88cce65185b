package io.iamcore.smtp;

import io.iamcore.AggregateRef;
import io.iamcore.Event;
import io.iamcore.IamAggregates;
import io.iamcore.ProtectedSecret;
import io.iamcore.command.ChangeDetector;
import io.iamcore.command.ChangeSet;
import io.iamcore.writemodel.WriteModel;

/**
 * SMTP configuration of one instance, folded from the instance stream.
 */
public final class SmtpConfigWriteModel extends WriteModel {
    private SmtpConfigState state = SmtpConfigState.UNSPECIFIED;
    private boolean tls;
    private String senderAddress;
    private String senderName;
    private String host;
    private String user;
    private ProtectedSecret password;

    public SmtpConfigWriteModel(String instanceId) {
        super(AggregateRef.of(IamAggregates.INSTANCE, instanceId, instanceId));
    }

    @Override
    protected void reduce(Event event) {
        if (!(event.type() instanceof SmtpConfigEvents)) {
            return;
        }
        switch ((SmtpConfigEvents) event.type()) {
            case SMTP_CONFIG_ADDED -> {
                SmtpConfigEvents.Added added = event.payload(SmtpConfigEvents.Added.class);
                state = SmtpConfigState.ACTIVE;
                tls = added.tls();
                senderAddress = added.senderAddress();
                senderName = added.senderName();
                host = added.host();
                user = added.user();
                password = added.password();
            }
            case SMTP_CONFIG_CHANGED -> {
                SmtpConfigEvents.Changed changed = event.payload(SmtpConfigEvents.Changed.class);
                if (changed.tls() != null) {
                    tls = changed.tls();
                }
                if (changed.senderAddress() != null) {
                    senderAddress = changed.senderAddress();
                }
                if (changed.senderName() != null) {
                    senderName = changed.senderName();
                }
                if (changed.host() != null) {
                    host = changed.host();
                }
                if (changed.user() != null) {
                    user = changed.user();
                }
            }
            case SMTP_CONFIG_PASSWORD_CHANGED ->
                    password = event.payload(SmtpConfigEvents.PasswordChanged.class).password();
            case SMTP_CONFIG_REMOVED -> {
                state = SmtpConfigState.REMOVED;
                tls = false;
                senderAddress = null;
                senderName = null;
                host = null;
                user = null;
                password = null;
            }
        }
    }

    /**
     * Computes the delta between the current and the proposed non-secret fields.
     */
    public ChangeSet<SmtpConfigEvents.Changed> newChangedEvent(SmtpConfig proposed) {
        ChangeDetector changes = new ChangeDetector();
        SmtpConfigEvents.Changed payload = new SmtpConfigEvents.Changed(
                changes.diff(tls, proposed.tls()),
                changes.diff(senderAddress, proposed.senderAddress()),
                changes.diff(senderName, proposed.senderName()),
                changes.diff(host, proposed.host()),
                changes.diff(user, proposed.user()));
        return new ChangeSet<>(payload, changes.hasChanges());
    }

    public SmtpConfigState state() {
        return state;
    }

    public boolean isActive() {
        return state == SmtpConfigState.ACTIVE;
    }

    public boolean tls() {
        return tls;
    }

    public String senderAddress() {
        return senderAddress;
    }

    public String senderName() {
        return senderName;
    }

    public String host() {
        return host;
    }

    public String user() {
        return user;
    }

    public ProtectedSecret password() {
        return password;
    }
}
