package com.phillippitts.lifecycle.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void returnsEmptyForNull() {
        assertThat(LogSanitizer.truncate(null)).isEmpty();
    }

    @Test
    void keepsShortInput() {
        assertThat(LogSanitizer.truncate("short", 10)).isEqualTo("short");
    }

    @Test
    void cutsLongInputWithEllipsis() {
        assertThat(LogSanitizer.truncate("abcdefghij", 6)).isEqualTo("abc...");
        assertThat(LogSanitizer.truncate("x".repeat(500))).hasSize(LogSanitizer.DEFAULT_MAX).endsWith("...");
    }

    @Test
    void flattensLineBreaks() {
        assertThat(LogSanitizer.truncate("line1\nline2\r\nline3")).isEqualTo("line1 line2  line3");
    }
}
