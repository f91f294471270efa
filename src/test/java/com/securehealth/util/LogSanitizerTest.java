package com.securehealth.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("valueSummary()")
    class ValueSummaryTest {
        @Test
        @DisplayName("Should return a marker for null")
        void shouldHandleNull() {
            assertThat(LogSanitizer.valueSummary(null)).isEqualTo("[null]");
        }

        @Test
        @DisplayName("Should return length and hash without the value")
        void shouldReturnLengthAndHash() {
            String result = LogSanitizer.valueSummary("Smith");
            assertThat(result).startsWith("[len=5,id=").endsWith("]").doesNotContain("Smith");
        }

        @Test
        @DisplayName("Should return consistent hash for same input")
        void shouldBeConsistent() {
            assertThat(LogSanitizer.valueSummary("hello")).isEqualTo(LogSanitizer.valueSummary("hello"));
        }
    }

    @Nested
    @DisplayName("sanitize()")
    class SanitizeTest {
        @Test
        @DisplayName("Should return empty string for null input")
        void shouldHandleNull() {
            assertThat(LogSanitizer.sanitize(null)).isEmpty();
        }

        @Test
        @DisplayName("Should strip newlines (replace with space)")
        void shouldReplaceNewlines() {
            assertThat(LogSanitizer.sanitize("line1\nline2\r")).isEqualTo("line1 line2");
        }

        @Test
        @DisplayName("Should strip control characters")
        void shouldStripControlChars() {
            assertThat(LogSanitizer.sanitize("a\u0000b\u001Bc")).isEqualTo("abc");
        }

        @Test
        @DisplayName("Should truncate long values")
        void shouldTruncate() {
            assertThat(LogSanitizer.sanitize("x".repeat(300))).hasSize(259).endsWith("...");
        }
    }
}
