package com.example.rental.service.exception;

/** Rejected input or an illegal status transition. The message is shown to the user as is. */
public class ValidationException extends BookingException {
    public ValidationException(String message) {
        super(message);
    }
}
