package com.securehealth.service;

import java.time.LocalDate;

/**
 * Basic-profile changes. Null components are left unchanged. Insurance has its own update.
 */
public record PatientDemographics(
        String firstName,
        String lastName,
        String email,
        String phoneNumber,
        LocalDate birthDate
) {
}
