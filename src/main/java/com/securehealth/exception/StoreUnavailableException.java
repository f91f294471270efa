package com.securehealth.exception;

public class StoreUnavailableException extends PhiCoreException {
    public StoreUnavailableException(String message) {
        super(ErrorKind.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
