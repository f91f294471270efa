package com.securehealth.exception;

/**
 * Base type for every error the core propagates to its callers.
 *
 * Messages must never contain key material or decrypted field values.
 */
public abstract class PhiCoreException extends RuntimeException {
    private final ErrorKind kind;

    protected PhiCoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PhiCoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return this.kind;
    }

    public boolean isRetryable() {
        return this.kind.isRetryable();
    }
}
