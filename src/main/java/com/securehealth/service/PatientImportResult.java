package com.securehealth.service;

import java.util.List;

/**
 * Outcome of a bulk patient import. Error messages name the record position, never its content.
 */
public record PatientImportResult(int total, int imported, int skipped, List<String> errors) {

    public PatientImportResult {
        errors = List.copyOf(errors);
    }
}
