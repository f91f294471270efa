package com.securehealth.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PhiMaskingConverterTest {

    @Test
    @DisplayName("Should redact SSNs, emails and phone numbers")
    void shouldRedactIdentifiers() {
        String masked = PhiMaskingConverter.mask("ssn=123-45-6789 mail=john@example.com tel=555-123-4567");

        assertThat(masked)
                .contains("[SSN-REDACTED]", "[EMAIL-REDACTED]", "[PHONE-REDACTED]")
                .doesNotContain("6789", "john@", "4567");
    }

    @Test
    @DisplayName("Should redact bare dates but keep timestamps")
    void shouldRedactBareDates() {
        assertThat(PhiMaskingConverter.mask("dob 1980-01-15")).isEqualTo("dob [DATE-REDACTED]");
        assertThat(PhiMaskingConverter.mask("at 2024-05-01T10:00:00Z")).contains("2024-05-01T10:00:00Z");
    }

    @Test
    @DisplayName("Should redact policy numbers")
    void shouldRedactPolicyNumbers() {
        assertThat(PhiMaskingConverter.mask("policy AH-00123456")).isEqualTo("policy [ID-REDACTED]");
    }

    @Test
    @DisplayName("Should leave ordinary text alone")
    void shouldKeepPlainText() {
        assertThat(PhiMaskingConverter.mask("Patient record created")).isEqualTo("Patient record created");
        assertThat(PhiMaskingConverter.mask(null)).isEmpty();
    }
}
