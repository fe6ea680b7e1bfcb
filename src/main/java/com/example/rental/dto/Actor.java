package com.example.rental.dto;

/** Who triggered a booking mutation; recorded in event payloads. */
public record Actor(Long id, String name) {

    public static Actor system() {
        return new Actor(0L, "system");
    }
}
