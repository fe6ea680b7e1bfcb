package com.example.rental.service.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DateInputParserTest {

    @Test
    void parsesDayMonthYear() {
        assertThat(DateInputParser.parse(" 05.06.2025 ")).contains(LocalDate.of(2025, 6, 5));
    }

    @Test
    void rejectsImpossibleAndForeignFormats() {
        assertThat(DateInputParser.parse("31.02.2025")).isEmpty();
        assertThat(DateInputParser.parse("2025-06-05")).isEmpty();
        assertThat(DateInputParser.parse("5.6.2025")).isEmpty();
        assertThat(DateInputParser.parse(null)).isEmpty();
    }

    @Test
    void rangeAllowsThirtyOneDatesAtMost() {
        LocalDate start = LocalDate.of(2025, 1, 1);
        assertThat(DateInputParser.isValidRange(start, start.plusDays(30))).isTrue();
        assertThat(DateInputParser.expand(start, start.plusDays(30))).hasSize(31);
        assertThat(DateInputParser.isValidRange(start, start.plusDays(31))).isFalse();
    }

    @Test
    void endBeforeStartIsNotARange() {
        LocalDate start = LocalDate.of(2025, 1, 10);
        assertThat(DateInputParser.isValidRange(start, start.minusDays(1))).isFalse();
    }

    @Test
    void expandIsInclusive() {
        LocalDate start = LocalDate.of(2025, 1, 30);
        assertThat(DateInputParser.expand(start, LocalDate.of(2025, 2, 1)))
                .containsExactly(start, LocalDate.of(2025, 1, 31), LocalDate.of(2025, 2, 1));
    }
}
