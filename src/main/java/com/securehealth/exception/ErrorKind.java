package com.securehealth.exception;

/**
 * Stable error kinds surfaced by the PHI core. The calling layer maps these to user-facing
 * responses; the kind survives propagation unchanged.
 */
public enum ErrorKind {
    KEY_VAULT_UNAVAILABLE(true),
    KEY_CORRUPT(false),
    SCHEMA_MISMATCH(false),
    DECRYPTION_FAILURE(false),
    POLICY_DENY(false),
    AUDIT_WRITE_FAILURE(false),
    MISSING_SUBJECT(false),
    STORE_UNAVAILABLE(true),
    NOT_FOUND(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return this.retryable;
    }
}
