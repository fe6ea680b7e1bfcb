package com.example.rental.controllers.impl;

import com.example.rental.controllers.MirrorSink;
import com.example.rental.dto.BookingDTO;
import com.example.rental.dto.ItemDTO;
import com.example.rental.dto.UserDTO;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Used when no mirror endpoint is configured: keeps the last written rows in memory and logs writes.
 */
@Slf4j
public class InMemoryMirrorSink implements MirrorSink {

    private final Map<Long, BookingDTO> bookings = new ConcurrentSkipListMap<>();
    private final Map<Long, UserDTO> users = new ConcurrentHashMap<>();
    private volatile Map<LocalDate, List<BookingDTO>> schedule = Map.of();

    @Override
    public void appendBooking(BookingDTO booking) {
        upsertBooking(booking);
    }

    @Override
    public void upsertBooking(BookingDTO booking) {
        bookings.put(booking.getId(), booking);
        log.info("Mirror: booking {} -> {} {} {}", booking.getId(), booking.getItemName(), booking.getDate(),
                booking.getStatus());
    }

    @Override
    public void updateBookingStatus(Long bookingId, String status) {
        BookingDTO row = bookings.get(bookingId);
        if (row == null) {
            log.warn("Mirror: status {} for unknown booking {}", status, bookingId);
            return;
        }
        row.setStatus(status);
        log.info("Mirror: booking {} status {}", bookingId, status);
    }

    @Override
    public void replaceBookingsSheet(List<BookingDTO> rows) {
        bookings.clear();
        rows.forEach(b -> bookings.put(b.getId(), b));
        log.info("Mirror: bookings sheet replaced with {} rows", rows.size());
    }

    @Override
    public void updateUsersSheet(List<UserDTO> rows) {
        users.clear();
        rows.forEach(u -> users.put(u.telegramId(), u));
        log.info("Mirror: users sheet replaced with {} rows", rows.size());
    }

    @Override
    public void updateScheduleSheet(LocalDate start, LocalDate end,
                                    Map<LocalDate, List<BookingDTO>> dailyBookings, List<ItemDTO> items) {
        schedule = Map.copyOf(dailyBookings);
        log.info("Mirror: schedule {}..{} rewritten, {} days with bookings, {} items",
                start, end, dailyBookings.size(), items.size());
    }

    public Optional<BookingDTO> booking(Long id) {
        return Optional.ofNullable(bookings.get(id));
    }

    public List<BookingDTO> bookings() {
        return new ArrayList<>(bookings.values());
    }

    public int userCount() {
        return users.size();
    }

    public Map<LocalDate, List<BookingDTO>> schedule() {
        return schedule;
    }
}
