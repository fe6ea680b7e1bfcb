package com.example.rental.service.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InputSanitizerTest {

    @Test
    void escapesMarkupAndCollapsesWhitespace() {
        assertThat(InputSanitizer.sanitize("  <b>Иван</b>\n\t 'Петров' "))
                .isEqualTo("&lt;b&gt;Иван&lt;/b&gt; &#39;Петров&#39;");
    }

    @Test
    void dropsControlCharacters() {
        assertThat(InputSanitizer.sanitize("Ан\u0000на\u0007")).isEqualTo("Анна");
    }

    @Test
    void truncatesLongInput() {
        assertThat(InputSanitizer.sanitize("x".repeat(800))).hasSize(InputSanitizer.MAX_LENGTH);
    }

    @Test
    void nameLengthBounds() {
        assertThat(InputSanitizer.isValidName("Я")).isFalse();
        assertThat(InputSanitizer.isValidName("Яна")).isTrue();
        assertThat(InputSanitizer.isValidName("a".repeat(150))).isTrue();
        assertThat(InputSanitizer.isValidName("a".repeat(151))).isFalse();
        assertThat(InputSanitizer.isValidName(null)).isFalse();
    }
}
