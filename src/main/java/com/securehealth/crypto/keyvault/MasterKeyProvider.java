package com.securehealth.crypto.keyvault;

/**
 * Wraps and unwraps data keys under a customer master key.
 */
public interface MasterKeyProvider {

    /**
     * Provider name recorded in the vault document, e.g. {@code local} or {@code aws}.
     */
    String providerName();

    String masterKeyId();

    byte[] wrap(byte[] dataKey);

    /**
     * @throws com.securehealth.exception.KeyCorruptException the wrapped bytes fail authentication
     * @throws com.securehealth.exception.KeyVaultUnavailableException the provider cannot be reached
     */
    byte[] unwrap(byte[] wrappedKey);
}
