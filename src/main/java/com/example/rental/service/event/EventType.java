package com.example.rental.service.event;

public enum EventType {
    BOOKING_CREATED("booking_created"),
    BOOKING_CONFIRMED("booking_confirmed"),
    BOOKING_CANCELED("booking_canceled"),
    BOOKING_COMPLETED("booking_completed"),
    BOOKING_ITEM_CHANGED("booking_item_changed");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
