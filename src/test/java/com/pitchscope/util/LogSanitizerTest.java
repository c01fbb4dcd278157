package com.pitchscope.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.preview("hello world", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenWithinMax() {
        assertThat(LogSanitizer.preview("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.preview("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldMarkTruncationWithEllipsis() {
        assertThat(LogSanitizer.preview("This is a long string", 10)).isEqualTo("This is...");
        assertThat(LogSanitizer.preview("a".repeat(10000), 100)).hasSize(100).endsWith("...");
    }

    @Test
    void shouldCutWithoutEllipsisForTinyLimits() {
        assertThat(LogSanitizer.preview("hello", 3)).isEqualTo("hel");
        assertThat(LogSanitizer.preview("hello", 1)).isEqualTo("h");
    }

    @Test
    void shouldFlattenLineBreaks() {
        assertThat(LogSanitizer.preview("first line\r\nsecond\nthird", 100)).isEqualTo("first line second third");
    }
}
