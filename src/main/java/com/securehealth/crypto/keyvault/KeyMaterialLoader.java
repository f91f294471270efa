package com.securehealth.crypto.keyvault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Resolves the 96-byte local master key.
 *
 * <p>Sources, first match wins:
 * <ol>
 *   <li>configured value, {@code base64:<key>}, plain Base64, or {@code kms:<ciphertext>} for a
 *       key that was itself encrypted with KMS</li>
 *   <li>key file, raw 96 bytes or Base64 text</li>
 *   <li>a freshly generated key, only when generation is allowed</li>
 * </ol>
 */
public class KeyMaterialLoader {
    private static final Logger log = LoggerFactory.getLogger(KeyMaterialLoader.class);
    private static final String BASE64_PREFIX = "base64:";
    private static final String KMS_PREFIX = "kms:";

    private final KmsClient kmsClient;
    private boolean generated;

    public KeyMaterialLoader(KmsClient kmsClient) {
        this.kmsClient = kmsClient;
    }

    public byte[] loadLocalMasterKey(String configuredKey, String keyFile, boolean generateIfMissing) {
        if (configuredKey != null && !configuredKey.isBlank()) {
            return checkLength(decodeConfigured(configuredKey.trim()), "configured value");
        }
        Path path = keyFile != null && !keyFile.isBlank() ? Path.of(keyFile) : null;
        if (path != null && Files.exists(path)) {
            return checkLength(readKeyFile(path), path.toString());
        }
        if (!generateIfMissing) {
            throw new IllegalStateException("No local master key configured. Set securehealth.encryption.master-key.value "
                    + "or securehealth.encryption.master-key.file, or enable generate-if-missing for development.");
        }
        byte[] key = new byte[LocalMasterKeyProvider.MASTER_KEY_LENGTH];
        new SecureRandom().nextBytes(key);
        this.generated = true;
        if (path != null) {
            writeKeyFile(path, key);
        }
        log.warn("=================================================================");
        log.warn("  LOCAL MASTER KEY: generated a new key (DEV MODE)");
        log.warn("  Data keys wrapped with it are unreadable without {}", path != null ? path : "this process");
        log.warn("  Configure a persistent key or AWS KMS for any shared environment.");
        log.warn("=================================================================");
        return key;
    }

    /**
     * True when the last load produced a newly generated key.
     */
    public boolean isGenerated() {
        return this.generated;
    }

    private byte[] decodeConfigured(String value) {
        if (value.startsWith(KMS_PREFIX)) {
            return decodeKmsKey(value.substring(KMS_PREFIX.length()));
        }
        return decodeBase64(value);
    }

    private byte[] decodeKmsKey(String ciphertext) {
        if (this.kmsClient == null) {
            throw new IllegalStateException("KMS-encrypted master key provided but securehealth.kms.enabled is false.");
        }
        DecryptRequest request = DecryptRequest.builder()
                .ciphertextBlob(SdkBytes.fromByteArray(Base64.getDecoder().decode(ciphertext)))
                .build();
        byte[] plaintext = this.kmsClient.decrypt(request).plaintext().asByteArray();
        return decodeBase64(new String(plaintext, StandardCharsets.UTF_8).trim());
    }

    private static byte[] readKeyFile(Path path) {
        try {
            byte[] raw = Files.readAllBytes(path);
            if (raw.length == LocalMasterKeyProvider.MASTER_KEY_LENGTH) {
                return raw;
            }
            return decodeBase64(new String(raw, StandardCharsets.US_ASCII).trim());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read master key file " + path, e);
        }
    }

    private static void writeKeyFile(Path path, byte[] key) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.write(path, key);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write master key file " + path, e);
        }
    }

    private static byte[] decodeBase64(String value) {
        if (value.startsWith(BASE64_PREFIX)) {
            return Base64.getDecoder().decode(value.substring(BASE64_PREFIX.length()));
        }
        return Base64.getDecoder().decode(value);
    }

    private static byte[] checkLength(byte[] key, String source) {
        if (key.length != LocalMasterKeyProvider.MASTER_KEY_LENGTH) {
            throw new IllegalArgumentException("Local master key from " + source + " must be "
                    + LocalMasterKeyProvider.MASTER_KEY_LENGTH + " bytes, got " + key.length);
        }
        return key;
    }
}
