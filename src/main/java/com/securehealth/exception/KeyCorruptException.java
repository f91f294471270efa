package com.securehealth.exception;

public class KeyCorruptException extends PhiCoreException {
    public KeyCorruptException(String message) {
        super(ErrorKind.KEY_CORRUPT, message);
    }

    public KeyCorruptException(String message, Throwable cause) {
        super(ErrorKind.KEY_CORRUPT, message, cause);
    }
}
