package com.securehealth.projection;

import com.securehealth.model.EntityType;
import com.securehealth.model.Role;

/**
 * Production visibility table.
 */
public final class DefaultVisibilityRules {
    private static final String[] PATIENT_BASICS = {
            "id", "firstName", "lastName", "email", "phoneNumber", "birthDate", "createdAt", "updatedAt"
    };
    private static final String[] KNOWLEDGE_FIELDS = {
            "id", "title", "content", "summary", "tags", "specialties", "source", "sourceUrl",
            "confidenceLevel", "evidenceLevel", "relatedConditions", "relatedMedications", "relatedProcedures",
            "requiresReview", "active", "createdAt", "updatedAt", "createdBy"
    };

    private DefaultVisibilityRules() {
    }

    public static FieldVisibilityTable create() {
        EntityType patient = EntityType.PATIENT;
        EntityType knowledge = EntityType.MEDICAL_KNOWLEDGE;
        return FieldVisibilityTable.builder()
                .masker(patient, "ssn", Masker.SSN)
                .masker(patient, "phoneNumber", Masker.PHONE)
                .masker(patient, "email", Masker.EMAIL)
                // clinicians see the whole record
                .visible(patient, Role.CLINICIAN, PATIENT_BASICS)
                .visible(patient, Role.CLINICIAN, "ssn", "diagnosis", "medications", "insuranceDetails",
                        "notes", "notesHistory", "primaryDoctorId")
                .visible(patient, Role.CARE_SUPPORT, PATIENT_BASICS)
                .visible(patient, Role.CARE_SUPPORT, "diagnosis", "medications", "notes", "notesHistory")
                .masked(patient, Role.CARE_SUPPORT, "ssn")
                .visible(patient, Role.FRONT_DESK, PATIENT_BASICS)
                .visible(patient, Role.FRONT_DESK, "insuranceDetails")
                .visible(patient, Role.ADMINISTRATOR, PATIENT_BASICS)
                .visible(patient, Role.ADMINISTRATOR, "insuranceDetails")
                // administrators never see clinical content, whatever other roles they hold
                .forbid(patient, Role.ADMINISTRATOR, "ssn", "diagnosis", "medications", "notes", "notesHistory")
                .visible(patient, Role.PATIENT_SELF, PATIENT_BASICS)
                .visible(patient, Role.PATIENT_SELF, "diagnosis", "medications", "insuranceDetails")
                .masked(patient, Role.PATIENT_SELF, "ssn")
                .visible(knowledge, Role.CLINICIAN, KNOWLEDGE_FIELDS)
                .visible(knowledge, Role.CARE_SUPPORT, KNOWLEDGE_FIELDS)
                .visible(knowledge, Role.ADMINISTRATOR, KNOWLEDGE_FIELDS)
                .build();
    }
}
