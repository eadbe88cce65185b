package io.iamcore.spi;

import io.iamcore.CommandException;
import io.iamcore.ProtectedSecret;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * {@link SecretProvider} using AES-GCM with a random 96-bit nonce per secret.
 *
 * <p>The token's ciphertext is {@code base64(nonce || ciphertext || tag)}.
 */
public final class AesGcmSecretProvider implements SecretProvider {
    public static final String ALGORITHM = "AES-GCM";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final String keyId;
    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    /**
     * @param keyId identifies the key in produced tokens
     * @param key   raw AES key, 16, 24 or 32 bytes
     */
    public AesGcmSecretProvider(String keyId, byte[] key) {
        this.keyId = Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(key, "key");
        if (key.length != 16 && key.length != 24 && key.length != 32) {
            throw new IllegalArgumentException("AES key must be 16, 24 or 32 bytes, got " + key.length);
        }
        this.key = new SecretKeySpec(key.clone(), "AES");
    }

    /**
     * Creates a provider from a base64 encoded key.
     */
    public static AesGcmSecretProvider fromBase64(String keyId, String base64Key) {
        Objects.requireNonNull(base64Key, "base64Key");
        return new AesGcmSecretProvider(keyId, Base64.getDecoder().decode(base64Key));
    }

    @Override
    public ProtectedSecret protect(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        try {
            byte[] nonce = new byte[NONCE_LENGTH];
            random.nextBytes(nonce);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] out = ByteBuffer.allocate(nonce.length + sealed.length).put(nonce).put(sealed).array();
            return new ProtectedSecret(ALGORITHM, keyId, Base64.getEncoder().encodeToString(out));
        } catch (GeneralSecurityException e) {
            throw CommandException.encryption("CRYPTO-PROTECT", e);
        }
    }

    @Override
    public String reveal(ProtectedSecret secret) {
        Objects.requireNonNull(secret, "secret");
        if (!ALGORITHM.equals(secret.algorithm()) || !keyId.equals(secret.keyId())) {
            throw CommandException.encryption("CRYPTO-KEY-MISMATCH",
                    new IllegalArgumentException("Unknown key " + secret.algorithm() + "/" + secret.keyId()));
        }
        try {
            byte[] in = Base64.getDecoder().decode(secret.ciphertext());
            if (in.length <= NONCE_LENGTH) {
                throw new IllegalArgumentException("ciphertext too short");
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, in, 0, NONCE_LENGTH));
            cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
            byte[] plain = cipher.doFinal(in, NONCE_LENGTH, in.length - NONCE_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw CommandException.encryption("CRYPTO-REVEAL", e);
        }
    }
}
