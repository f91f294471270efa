package com.securehealth.codec;

import org.bson.Document;

/**
 * Converts between a plaintext domain object and its stored, field-encrypted document.
 * Implementations hold no plaintext beyond a single call.
 */
public interface RecordCodec<T> {

    String documentType();

    Document toStorage(T entity);

    /**
     * @throws com.securehealth.exception.DecryptionFailureException carrying the record id and field
     * @throws com.securehealth.exception.SchemaMismatchException a field was written under another class
     */
    T fromStorage(Document stored);
}
