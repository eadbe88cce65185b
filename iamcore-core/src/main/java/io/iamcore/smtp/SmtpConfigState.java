package io.iamcore.smtp;

public enum SmtpConfigState {
    UNSPECIFIED,
    ACTIVE,
    REMOVED
}
