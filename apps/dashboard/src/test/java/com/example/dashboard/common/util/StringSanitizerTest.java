package com.example.dashboard.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StringSanitizer")
class StringSanitizerTest {

    @Test
    @DisplayName("should strip line breaks, tabs and other control characters")
    void shouldStripControlCharacters() {
        assertThat(StringSanitizer.forLog("doc\r\nFAKE LOG\tline\u0007")).isEqualTo("docFAKE LOGline");
    }

    @Test
    @DisplayName("should mark truncated values")
    void shouldMarkTruncatedValues() {
        assertThat(StringSanitizer.forLog("abcdefghij", 4)).isEqualTo("abcd...");
        assertThat(StringSanitizer.forLog("abcd", 4)).isEqualTo("abcd");
    }

    @Test
    @DisplayName("should render null")
    void shouldRenderNull() {
        assertThat(StringSanitizer.forLog(null)).isEqualTo("null");
    }
}
