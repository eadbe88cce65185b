package io.iamcore;

import java.util.Objects;

/**
 * Opaque ciphertext token produced by a {@link io.iamcore.spi.SecretProvider}.
 *
 * @param algorithm  the protection algorithm identifier
 * @param keyId      identifies the key material used
 * @param ciphertext base64 encoded ciphertext
 */
public record ProtectedSecret(String algorithm, String keyId, String ciphertext) {

    public ProtectedSecret {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(ciphertext, "ciphertext");
    }

    @Override
    public String toString() {
        return "ProtectedSecret{algorithm=" + algorithm + ", keyId=" + keyId + "}";
    }
}
