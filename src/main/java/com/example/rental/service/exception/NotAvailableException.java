package com.example.rental.service.exception;

import java.time.LocalDate;

public class NotAvailableException extends BookingException {
    public NotAvailableException(Long itemId, LocalDate date) {
        super("Item " + itemId + " is fully booked on " + date);
    }
}
