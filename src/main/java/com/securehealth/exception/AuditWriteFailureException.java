package com.securehealth.exception;

public class AuditWriteFailureException extends PhiCoreException {
    public AuditWriteFailureException(String message) {
        super(ErrorKind.AUDIT_WRITE_FAILURE, message);
    }

    public AuditWriteFailureException(String message, Throwable cause) {
        super(ErrorKind.AUDIT_WRITE_FAILURE, message, cause);
    }
}
