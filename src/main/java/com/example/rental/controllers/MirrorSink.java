package com.example.rental.controllers;

import com.example.rental.dto.BookingDTO;
import com.example.rental.dto.ItemDTO;
import com.example.rental.dto.UserDTO;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Spreadsheet mirror of the booking data. Every write is idempotent per booking id.
 * Failures are reported as {@link com.example.rental.service.exception.RemoteSinkException}.
 */
public interface MirrorSink {

    void appendBooking(BookingDTO booking);

    /** Append-or-update the row of the booking. */
    void upsertBooking(BookingDTO booking);

    void updateBookingStatus(Long bookingId, String status);

    void replaceBookingsSheet(List<BookingDTO> bookings);

    void updateUsersSheet(List<UserDTO> users);

    /** Rewrites the day x item grid for {@code start..end}. */
    void updateScheduleSheet(LocalDate start, LocalDate end,
                             Map<LocalDate, List<BookingDTO>> dailyBookings, List<ItemDTO> items);
}
