package com.example.rental.service.event;

import com.example.rental.model.Booking;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

public record BookingEventPayload(Long bookingId,
                                  Long userId,
                                  String userName,
                                  Long itemId,
                                  String itemName,
                                  String status,
                                  @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
                                  String comment,
                                  long version,
                                  String changedBy,
                                  Long changedById) {

    public static BookingEventPayload of(Booking b, String changedBy, Long changedById) {
        return new BookingEventPayload(b.getId(), b.getUserId(), b.getUserName(), b.getItemId(), b.getItemName(),
                b.getStatus().code(), b.getDate(), b.getComment(), b.getVersion(), changedBy, changedById);
    }
}
