package com.example.rental.service.exception;

import lombok.Getter;

import java.time.LocalDate;

@Getter
public class DateTooFarException extends BookingTimeRestrictionException {
    private final int maxDays;

    public DateTooFarException(LocalDate date, int maxDays) {
        super("Booking date " + date + " is more than " + maxDays + " days ahead");
        this.maxDays = maxDays;
    }
}
