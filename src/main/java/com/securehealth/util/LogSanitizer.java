package com.securehealth.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // Control characters enable log forging through injected line breaks.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_LENGTH = 256;

    private LogSanitizer() {
    }

    /**
     * Strips control characters and folds line breaks so a value stays on one log line.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_LENGTH ? cleaned.substring(0, MAX_LENGTH) + "..." : cleaned;
    }

    /**
     * Length and hash of a search term, for logging queries without their content.
     */
    public static String valueSummary(Object value) {
        if (value == null) {
            return "[null]";
        }
        String text = String.valueOf(value);
        return "[len=" + text.length() + ",id=" + Integer.toHexString(text.hashCode()) + "]";
    }
}
