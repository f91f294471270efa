package com.securehealth.exception;

/**
 * A stored ciphertext could not be turned back into plaintext. This is a data-integrity
 * failure for one record, never an indication that the value is absent.
 */
public class DecryptionFailureException extends PhiCoreException {
    private final String recordId;
    private final String fieldName;

    public DecryptionFailureException(String fieldName, String message) {
        this(null, fieldName, message, null);
    }

    public DecryptionFailureException(String fieldName, String message, Throwable cause) {
        this(null, fieldName, message, cause);
    }

    public DecryptionFailureException(String recordId, String fieldName, String message, Throwable cause) {
        super(ErrorKind.DECRYPTION_FAILURE, message, cause);
        this.recordId = recordId;
        this.fieldName = fieldName;
    }

    public DecryptionFailureException forRecord(String recordId) {
        return new DecryptionFailureException(recordId, this.fieldName,
                "Record " + recordId + ": " + getMessage(), getCause());
    }

    public String getRecordId() {
        return this.recordId;
    }

    public String getFieldName() {
        return this.fieldName;
    }
}
