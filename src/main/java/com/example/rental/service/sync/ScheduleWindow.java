package com.example.rental.service.sync;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record ScheduleWindow(@JsonFormat(pattern = "yyyy-MM-dd") LocalDate start,
                             @JsonFormat(pattern = "yyyy-MM-dd") LocalDate end) {

    /** One month behind to two months ahead of {@code today}. */
    public static ScheduleWindow around(LocalDate today) {
        return new ScheduleWindow(today.minusMonths(1), today.plusMonths(2));
    }
}
