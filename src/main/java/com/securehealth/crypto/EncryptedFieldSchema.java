package com.securehealth.crypto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Document type -> field -> {@link EncryptionClass}. Built once at startup and immutable
 * afterwards; reclassifying a field requires migrating the stored data.
 */
public final class EncryptedFieldSchema {
    public static final String PATIENT = "patient";

    private final Map<String, Map<String, EncryptionClass>> fields;

    private EncryptedFieldSchema(Map<String, Map<String, EncryptionClass>> fields) {
        this.fields = fields;
    }

    /**
     * Classification used by patient records.
     */
    public static EncryptedFieldSchema defaultSchema() {
        return builder()
                .field(PATIENT, "firstName", EncryptionClass.DETERMINISTIC)
                .field(PATIENT, "lastName", EncryptionClass.DETERMINISTIC)
                .field(PATIENT, "email", EncryptionClass.DETERMINISTIC)
                .field(PATIENT, "phoneNumber", EncryptionClass.DETERMINISTIC)
                .field(PATIENT, "birthDate", EncryptionClass.RANGE)
                .field(PATIENT, "ssn", EncryptionClass.RANDOM)
                .field(PATIENT, "diagnosis", EncryptionClass.RANDOM)
                .field(PATIENT, "medications", EncryptionClass.RANDOM)
                .field(PATIENT, "insuranceDetails", EncryptionClass.RANDOM)
                .field(PATIENT, "notes", EncryptionClass.RANDOM)
                .field(PATIENT, "notesHistory", EncryptionClass.RANDOM)
                .build();
    }

    public Optional<EncryptionClass> classify(String documentType, String fieldName) {
        return Optional.ofNullable(this.fields.getOrDefault(documentType, Map.of()).get(fieldName));
    }

    public boolean isEncrypted(String documentType, String fieldName) {
        return classify(documentType, fieldName).isPresent();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Map<String, EncryptionClass>> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder field(String documentType, String fieldName, EncryptionClass encryptionClass) {
            EncryptionClass previous = this.fields.computeIfAbsent(documentType, k -> new LinkedHashMap<>())
                    .putIfAbsent(fieldName, encryptionClass);
            if (previous != null) {
                throw new IllegalStateException("Field " + documentType + "." + fieldName + " is already classified as " + previous);
            }
            return this;
        }

        public EncryptedFieldSchema build() {
            Map<String, Map<String, EncryptionClass>> copy = new LinkedHashMap<>();
            this.fields.forEach((type, byField) -> copy.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(byField))));
            return new EncryptedFieldSchema(Collections.unmodifiableMap(copy));
        }
    }
}
