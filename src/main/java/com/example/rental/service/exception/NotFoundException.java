package com.example.rental.service.exception;

public class NotFoundException extends BookingException {
    public NotFoundException(String what, Object id) {
        super(what + " not found: " + id);
    }
}
