package com.securehealth.store;

import org.bson.Document;

import java.util.List;
import java.util.Optional;

/**
 * Raw document persistence for encrypted records. Values handed in are already in their stored
 * form; this layer never sees plaintext of classified fields.
 */
public interface DocumentStore {

    void insert(String collection, Document document);

    /**
     * Replaces the document with the same {@code _id}.
     *
     * @throws com.securehealth.exception.RecordNotFoundException no document has that id
     */
    void replace(String collection, Document document);

    Optional<Document> findById(String collection, String id);

    /**
     * Equality match on a top-level field. For encrypted fields pass the stored form of the
     * equality token.
     */
    List<Document> findByField(String collection, String field, Object value, int limit);

    /**
     * Documents whose order token for {@code field} lies within the inclusive bounds.
     */
    List<Document> findByRangeToken(String collection, String field, byte[] lower, byte[] upper, int limit);

    List<Document> findAll(String collection, int limit);

    boolean deleteById(String collection, String id);
}
