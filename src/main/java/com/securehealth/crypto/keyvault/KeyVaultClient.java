package com.securehealth.crypto.keyvault;

import java.util.Optional;
import java.util.UUID;

/**
 * Access to data encryption keys. The only component that sees raw key material.
 */
public interface KeyVaultClient {

    /**
     * Returns the key registered under the alt name, creating it on first use. Concurrent
     * first callers all receive the same key.
     *
     * @throws com.securehealth.exception.KeyVaultUnavailableException vault unreachable after retries
     * @throws com.securehealth.exception.KeyCorruptException key present but unusable
     */
    KeyHandle getOrCreateDataKey(String keyAltName);

    /**
     * Resolves a key by id, as referenced from a stored ciphertext. Empty when no such key exists.
     */
    Optional<KeyHandle> getDataKey(UUID keyId);
}
