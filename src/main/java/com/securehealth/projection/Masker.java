package com.securehealth.projection;

/**
 * Redacts a value shown as {@link Visibility#MASKED}. A mask never reproduces the plaintext.
 */
@FunctionalInterface
public interface Masker {
    String OPAQUE = "****";

    String mask(Object value);

    /**
     * {@code ***-**-1234}
     */
    Masker SSN = value -> "***-**-" + lastDigits(value, 4);

    /**
     * {@code ***-***-1234}
     */
    Masker PHONE = value -> "***-***-" + lastDigits(value, 4);

    /**
     * {@code j***@example.com}
     */
    Masker EMAIL = value -> {
        String text = String.valueOf(value);
        int at = text.indexOf('@');
        if (at <= 0) {
            return OPAQUE;
        }
        return text.charAt(0) + "***" + text.substring(at);
    };

    /**
     * Lists, maps, dates and free text.
     */
    Masker OPAQUE_VALUE = value -> OPAQUE;

    private static String lastDigits(Object value, int count) {
        String digits = String.valueOf(value).replaceAll("\\D", "");
        if (digits.length() < count) {
            return OPAQUE;
        }
        return digits.substring(digits.length() - count);
    }
}
