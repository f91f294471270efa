package com.securehealth.model;

/**
 * Entity types governed by the policy rule table.
 */
public enum EntityType {
    PATIENT("patient"),
    MEDICAL_KNOWLEDGE("medical_knowledge"),
    AUDIT_LOG("audit_log");

    private final String documentType;

    EntityType(String documentType) {
        this.documentType = documentType;
    }

    /**
     * Name used for the encrypted field schema and as the storage collection.
     */
    public String getDocumentType() {
        return this.documentType;
    }
}
