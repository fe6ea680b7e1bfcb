package com.example.rental.service.exception;

/** Root of domain failures that are reported back to the chat user. */
public abstract class BookingException extends RuntimeException {
    protected BookingException(String message) {
        super(message);
    }
}
