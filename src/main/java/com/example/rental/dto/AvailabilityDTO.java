package com.example.rental.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record AvailabilityDTO(String item,
                              LocalDate date,
                              boolean available,
                              @JsonProperty("booked_count") long bookedCount,
                              int total) {
}
