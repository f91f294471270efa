package com.securehealth.crypto.keyvault;

import com.securehealth.exception.KeyCorruptException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Master key held by the process itself, for development and single-node deployments.
 *
 * Data keys are wrapped with AES-256-GCM under the first 32 bytes of the 96-byte local key.
 * Wrapped format: nonce(12) || ciphertext || tag(16).
 */
public class LocalMasterKeyProvider implements MasterKeyProvider {
    public static final int MASTER_KEY_LENGTH = 96;
    private static final String AES_GCM_ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final byte[] WRAP_AAD = "securehealth:data-key".getBytes(StandardCharsets.UTF_8);

    private final SecretKeySpec wrappingKey;
    private final String masterKeyId;
    private final SecureRandom random = new SecureRandom();

    public LocalMasterKeyProvider(byte[] masterKey) {
        if (masterKey == null || masterKey.length != MASTER_KEY_LENGTH) {
            throw new IllegalArgumentException("Local master key must be " + MASTER_KEY_LENGTH + " bytes");
        }
        this.wrappingKey = new SecretKeySpec(Arrays.copyOf(masterKey, 32), "AES");
        this.masterKeyId = "local:" + fingerprint(masterKey);
    }

    @Override
    public String providerName() {
        return "local";
    }

    @Override
    public String masterKeyId() {
        return this.masterKeyId;
    }

    @Override
    public byte[] wrap(byte[] dataKey) {
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            this.random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(AES_GCM_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, this.wrappingKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(WRAP_AAD);
            byte[] ciphertext = cipher.doFinal(dataKey);
            return ByteBuffer.allocate(iv.length + ciphertext.length).put(iv).put(ciphertext).array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Data key wrapping failed", e);
        }
    }

    @Override
    public byte[] unwrap(byte[] wrappedKey) {
        if (wrappedKey == null || wrappedKey.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new KeyCorruptException("Wrapped data key is truncated");
        }
        try {
            Cipher cipher = Cipher.getInstance(AES_GCM_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, this.wrappingKey, new GCMParameterSpec(GCM_TAG_LENGTH, wrappedKey, 0, GCM_IV_LENGTH));
            cipher.updateAAD(WRAP_AAD);
            return cipher.doFinal(wrappedKey, GCM_IV_LENGTH, wrappedKey.length - GCM_IV_LENGTH);
        } catch (AEADBadTagException e) {
            throw new KeyCorruptException("Data key failed authentication under the local master key", e);
        } catch (GeneralSecurityException e) {
            throw new KeyCorruptException("Data key could not be unwrapped", e);
        }
    }

    private static String fingerprint(byte[] masterKey) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(masterKey);
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
