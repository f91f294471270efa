package com.securehealth.exception;

public class RecordNotFoundException extends PhiCoreException {
    public RecordNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public RecordNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
