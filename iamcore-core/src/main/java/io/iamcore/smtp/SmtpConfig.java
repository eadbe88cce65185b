package io.iamcore.smtp;

/**
 * SMTP settings of an instance as supplied by the caller.
 *
 * @param tls           whether to use TLS
 * @param senderAddress the from address
 * @param senderName    the from display name
 * @param host          the SMTP host, optionally with port
 * @param user          the SMTP user
 * @param password      the plaintext password; empty or {@code null} for none. Ignored by
 *                      {@link SmtpConfigCommands#changeSmtpConfig}.
 */
public record SmtpConfig(
        boolean tls,
        String senderAddress,
        String senderName,
        String host,
        String user,
        String password) {

    @Override
    public String toString() {
        return "SmtpConfig{tls=" + tls + ", senderAddress=" + senderAddress + ", senderName=" + senderName
                + ", host=" + host + ", user=" + user + "}";
    }
}
