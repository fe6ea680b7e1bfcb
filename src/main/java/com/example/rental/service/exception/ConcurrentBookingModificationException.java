package com.example.rental.service.exception;

public class ConcurrentBookingModificationException extends BookingException {
    public ConcurrentBookingModificationException(String message) {
        super(message);
    }
}
