package com.securehealth.crypto.keyvault;

import com.securehealth.exception.KeyCorruptException;

import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Unwrapped data encryption key. The 64 bytes of material split into a 32-byte AES-256 key and
 * a 32-byte HMAC key used to derive deterministic nonces and order-token scales.
 */
public record KeyHandle(UUID keyId, String keyAltName, byte[] material) {
    public static final int MATERIAL_LENGTH = 64;
    private static final int AES_KEY_LENGTH = 32;

    public KeyHandle {
        if (keyId == null) {
            throw new KeyCorruptException("Data key has no id");
        }
        if (material == null || material.length != MATERIAL_LENGTH) {
            throw new KeyCorruptException("Data key " + keyId + " has invalid length");
        }
        material = material.clone();
    }

    public SecretKeySpec encryptionKey() {
        return new SecretKeySpec(this.material, 0, AES_KEY_LENGTH, "AES");
    }

    public SecretKeySpec nonceKey() {
        return new SecretKeySpec(this.material, AES_KEY_LENGTH, MATERIAL_LENGTH - AES_KEY_LENGTH, "HmacSHA256");
    }

    public byte[] keyIdBytes() {
        return toBytes(this.keyId);
    }

    @Override
    public byte[] material() {
        return this.material.clone();
    }

    @Override
    public String toString() {
        return "KeyHandle[keyId=" + this.keyId + ", keyAltName=" + this.keyAltName + ", material=<redacted>]";
    }

    static byte[] toBytes(UUID uuid) {
        return ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }

    public static UUID fromBytes(byte[] bytes, int offset) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}
