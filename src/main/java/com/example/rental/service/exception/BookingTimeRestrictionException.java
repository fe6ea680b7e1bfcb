package com.example.rental.service.exception;

public abstract class BookingTimeRestrictionException extends BookingException {
    protected BookingTimeRestrictionException(String message) {
        super(message);
    }
}
