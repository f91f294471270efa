package com.securehealth.crypto.keyvault;

import com.securehealth.exception.KeyCorruptException;
import com.securehealth.exception.KeyVaultUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.EncryptRequest;
import software.amazon.awssdk.services.kms.model.IncorrectKeyException;
import software.amazon.awssdk.services.kms.model.InvalidCiphertextException;

import java.util.Map;

/**
 * Wraps data keys with an AWS KMS customer master key.
 */
public class KmsMasterKeyProvider implements MasterKeyProvider {
    private static final Logger log = LoggerFactory.getLogger(KmsMasterKeyProvider.class);
    private static final Map<String, String> ENCRYPTION_CONTEXT = Map.of("purpose", "securehealth-data-key");

    private final KmsClient client;
    private final String keyArn;

    public KmsMasterKeyProvider(KmsClient client, String keyArn) {
        if (keyArn == null || keyArn.isBlank()) {
            throw new IllegalArgumentException("KMS key ARN is blank.");
        }
        this.client = client;
        this.keyArn = keyArn;
        log.info("KMS master key provider initialized.");
    }

    @Override
    public String providerName() {
        return "aws";
    }

    @Override
    public String masterKeyId() {
        return this.keyArn;
    }

    @Override
    public byte[] wrap(byte[] dataKey) {
        EncryptRequest request = EncryptRequest.builder()
                .keyId(this.keyArn)
                .plaintext(SdkBytes.fromByteArray(dataKey))
                .encryptionContext(ENCRYPTION_CONTEXT)
                .build();
        try {
            return this.client.encrypt(request).ciphertextBlob().asByteArray();
        } catch (SdkException e) {
            throw new KeyVaultUnavailableException("KMS encrypt failed", e);
        }
    }

    @Override
    public byte[] unwrap(byte[] wrappedKey) {
        DecryptRequest request = DecryptRequest.builder()
                .keyId(this.keyArn)
                .ciphertextBlob(SdkBytes.fromByteArray(wrappedKey))
                .encryptionContext(ENCRYPTION_CONTEXT)
                .build();
        try {
            return this.client.decrypt(request).plaintext().asByteArray();
        } catch (InvalidCiphertextException | IncorrectKeyException e) {
            throw new KeyCorruptException("KMS rejected the wrapped data key", e);
        } catch (SdkException e) {
            throw new KeyVaultUnavailableException("KMS decrypt failed", e);
        }
    }
}
