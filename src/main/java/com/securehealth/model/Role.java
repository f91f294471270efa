package com.securehealth.model;

/**
 * Closed set of roles a principal can hold. Capabilities live in the policy rule table and
 * the projection visibility table, not here.
 */
public enum Role {
    ADMINISTRATOR,
    CLINICIAN,
    CARE_SUPPORT,
    FRONT_DESK,
    PATIENT_SELF
}
