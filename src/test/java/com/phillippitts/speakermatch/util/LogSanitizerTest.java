package com.phillippitts.speakermatch.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
        assertThat(LogSanitizer.preview("hello world", 0)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenNotLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("a".repeat(1000), 800)).hasSize(800);
    }

    @Test
    void shouldNotSplitSurrogatePair() {
        String bio = "a".repeat(799) + "\uD83D\uDE80" + "tail";

        String cut = LogSanitizer.truncate(bio, 800);

        assertThat(cut).isEqualTo("a".repeat(799));
        assertThat(Character.isHighSurrogate(cut.charAt(cut.length() - 1))).isFalse();
        assertThat(LogSanitizer.truncate(bio, 801)).endsWith("\uD83D\uDE80");
        assertThat(LogSanitizer.preview("ab\uD83D\uDE80cd", 3)).isEqualTo("ab...");
    }

    @Test
    void previewCollapsesWhitespace() {
        assertThat(LogSanitizer.preview("  {\n  \"score\":\t8 }  ", 100)).isEqualTo("{ \"score\": 8 }");
    }

    @Test
    void previewMarksCutText() {
        assertThat(LogSanitizer.preview("abcdefghij", 4)).isEqualTo("abcd...");
        assertThat(LogSanitizer.preview("abcd", 4)).isEqualTo("abcd");
    }
}
