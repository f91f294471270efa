package com.securehealth.exception;

public class SchemaMismatchException extends PhiCoreException {
    public SchemaMismatchException(String message) {
        super(ErrorKind.SCHEMA_MISMATCH, message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(ErrorKind.SCHEMA_MISMATCH, message, cause);
    }
}
