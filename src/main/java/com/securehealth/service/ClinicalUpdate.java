package com.securehealth.service;

import java.util.List;

/**
 * Changes to the sensitive subset of a patient record. Null components are left unchanged;
 * a non-blank note is appended to the note history.
 */
public record ClinicalUpdate(
        String ssn,
        List<String> diagnosis,
        List<String> medications,
        String note
) {
}
