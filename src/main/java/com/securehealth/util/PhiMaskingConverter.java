package com.securehealth.util;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.regex.Pattern;

/**
 * Last-line scrubbing of PHI-shaped tokens in rendered log messages. Code must still avoid
 * logging decrypted values; this only catches mistakes.
 */
public class PhiMaskingConverter extends ClassicConverter {
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-?\\d{2}-?\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile(
            "\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern PHONE = Pattern.compile("\\b(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");
    // Bare dates only; an ISO instant continues with "T" and has no word boundary there.
    private static final Pattern ISO_DATE = Pattern.compile("\\b(?:19|20)\\d{2}-\\d{2}-\\d{2}\\b");
    private static final Pattern POLICY_NUMBER = Pattern.compile("\\b[A-Z]{2,4}-?\\d{6,12}\\b");

    @Override
    public String convert(ILoggingEvent event) {
        return mask(event.getFormattedMessage());
    }

    public static String mask(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }
        String sanitized = message;
        sanitized = SSN.matcher(sanitized).replaceAll("[SSN-REDACTED]");
        sanitized = EMAIL.matcher(sanitized).replaceAll("[EMAIL-REDACTED]");
        sanitized = PHONE.matcher(sanitized).replaceAll("[PHONE-REDACTED]");
        sanitized = ISO_DATE.matcher(sanitized).replaceAll("[DATE-REDACTED]");
        sanitized = POLICY_NUMBER.matcher(sanitized).replaceAll("[ID-REDACTED]");
        return sanitized;
    }
}
