package com.example.rental.service;

import com.example.rental.dto.Actor;
import com.example.rental.model.Booking;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Booking lifecycle: date rules, capacity, status transitions. Every mutation publishes its
 * domain event and queues the matching mirror sync.
 */
public interface BookingService {

    /**
     * @throws com.example.rental.service.exception.PastDateException
     * @throws com.example.rental.service.exception.DateTooFarException
     */
    void validateDate(LocalDate date);

    boolean checkAvailability(Long itemId, LocalDate date);

    long bookedCount(Long itemId, LocalDate date);

    /** Active bookings per day for {@code days} days from {@code start}; free days map to 0. */
    Map<LocalDate, Long> availabilityForPeriod(Long itemId, LocalDate start, int days);

    /** Creates a pending booking requested by a user. */
    Booking createBooking(Booking draft);

    /** Creates a confirmed booking on behalf of a client. */
    Booking createManagerBooking(Booking draft, Actor manager);

    Booking confirm(Long id, long version, Actor manager);

    Booking reject(Long id, long version, Actor manager);

    Booking complete(Long id, long version, Actor manager);

    Booking reopen(Long id, long version, Actor manager);

    Booking reschedule(Long id, long version, Actor manager);

    Booking changeItem(Long id, long version, Long newItemId, Actor manager);

    Optional<Booking> findBooking(Long id);

    List<Booking> bookingsInRange(LocalDate start, LocalDate end);

    /** Bookings of the user from two weeks ago on. */
    List<Booking> userBookings(Long userId);

    /** Confirmed or changed bookings on the date. */
    List<Booking> bookingsToRemind(LocalDate date);

    void requestScheduleSync();

    void requestBookingsResync();

    void requestUsersSync();
}
