package io.iamcore.spi;

import io.iamcore.ProtectedSecret;

/**
 * Turns plaintext secrets into opaque ciphertext tokens before they are put in events.
 *
 * @see AesGcmSecretProvider
 */
public interface SecretProvider {

    /**
     * Protects a plaintext secret.
     *
     * @param plaintext the secret, never empty
     * @return the protected token
     * @throws io.iamcore.CommandException with {@code ENCRYPTION_ERROR} on failure
     */
    ProtectedSecret protect(String plaintext);

    /**
     * Recovers the plaintext of a token produced by {@link #protect}.
     *
     * @throws io.iamcore.CommandException with {@code ENCRYPTION_ERROR} on failure
     */
    String reveal(ProtectedSecret secret);
}
