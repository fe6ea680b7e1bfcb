package com.example.rental.dto;

import com.example.rental.model.Booking;

public record BookingWithAvailability(Booking booking, boolean available) {
}
