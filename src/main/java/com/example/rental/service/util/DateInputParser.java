package com.example.rental.service.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class DateInputParser {
    private DateInputParser() {}

    public static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    public static final int MAX_RANGE_DAYS = 30;

    /** {@code DD.MM.YYYY}; empty for anything else, including impossible dates. */
    public static Optional<LocalDate> parse(String text) {
        if (text == null) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(text.trim(), DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return date.format(DATE);
    }

    /** At most {@value #MAX_RANGE_DAYS} days between start and end, i.e. 31 dates. */
    public static boolean isValidRange(LocalDate start, LocalDate end) {
        return !end.isBefore(start) && ChronoUnit.DAYS.between(start, end) <= MAX_RANGE_DAYS;
    }

    public static List<LocalDate> expand(LocalDate start, LocalDate end) {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            dates.add(d);
        }
        return dates;
    }
}
