package com.securehealth.exception;

public class KeyVaultUnavailableException extends PhiCoreException {
    public KeyVaultUnavailableException(String message) {
        super(ErrorKind.KEY_VAULT_UNAVAILABLE, message);
    }

    public KeyVaultUnavailableException(String message, Throwable cause) {
        super(ErrorKind.KEY_VAULT_UNAVAILABLE, message, cause);
    }
}
