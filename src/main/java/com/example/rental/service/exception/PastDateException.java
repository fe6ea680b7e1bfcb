package com.example.rental.service.exception;

import java.time.LocalDate;

public class PastDateException extends BookingTimeRestrictionException {
    public PastDateException(LocalDate date) {
        super("Booking date " + date + " is in the past or too close");
    }
}
