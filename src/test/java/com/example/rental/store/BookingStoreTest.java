package com.example.rental.store;

import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.model.Item;
import com.example.rental.repository.BookingRepository;
import com.example.rental.repository.ItemRepository;
import com.example.rental.service.exception.ConcurrentBookingModificationException;
import com.example.rental.service.exception.NotAvailableException;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class BookingStoreTest {

    static final LocalDate DAY = LocalDate.of(2025, 6, 10);

    @Autowired
    private BookingRepository bookingRepo;
    @Autowired
    private ItemRepository itemRepo;
    @Autowired
    private PlatformTransactionManager txManager;

    private BookingStore store;
    private Item camera;
    private Item drone;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T07:00:00Z"), ZoneId.of("Europe/Moscow"));
        store = new BookingStore(bookingRepo, itemRepo, txManager, clock);
        ItemStore items = new ItemStore(itemRepo, bookingRepo, txManager, clock);
        camera = items.createItem("Canon R6", null, 1);
        drone = items.createItem("DJI Mini", null, 2);
    }

    @Test
    void newBookingStartsAtVersionOne() {
        Booking created = store.createBookingWithLock(draft(camera, DAY, BookingStatus.PENDING));

        assertThat(created.getId()).isNotNull();
        assertThat(created.getVersion()).isEqualTo(1L);
        assertThat(created.getItemName()).isEqualTo("Canon R6");
        assertThat(store.bookedCount(camera.getId(), DAY)).isEqualTo(1L);
    }

    @Test
    void capacityIsEnforcedPerItemAndDay() {
        store.createBookingWithLock(draft(camera, DAY, BookingStatus.PENDING));
        store.createBookingWithLock(draft(camera, DAY.plusDays(1), BookingStatus.PENDING));
        store.createBookingWithLock(draft(drone, DAY, BookingStatus.PENDING));
        store.createBookingWithLock(draft(drone, DAY, BookingStatus.PENDING));
        assertThat(store.bookedCount(drone.getId(), DAY)).isEqualTo(2L);

        assertThatThrownBy(() -> store.createBookingWithLock(draft(camera, DAY, BookingStatus.CONFIRMED)))
                .isInstanceOf(NotAvailableException.class);
        assertThat(store.bookedCount(camera.getId(), DAY)).isEqualTo(1L);
    }

    @Test
    void canceledBookingFreesItsUnit() {
        Booking first = store.createBookingWithLock(draft(camera, DAY, BookingStatus.PENDING));
        store.updateBookingStatusWithVersion(first.getId(), first.getVersion(), BookingStatus.CANCELED);

        Booking second = store.createBookingWithLock(draft(camera, DAY, BookingStatus.PENDING));

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(store.bookedCount(camera.getId(), DAY)).isEqualTo(1L);
    }

    @Test
    void staleVersionIsRejected() {
        Booking booking = store.createBookingWithLock(draft(camera, DAY, BookingStatus.PENDING));

        Booking confirmed = store.updateBookingStatusWithVersion(booking.getId(), 1L, BookingStatus.CONFIRMED);
        assertThat(confirmed.getVersion()).isEqualTo(2L);
        assertThat(confirmed.getStatus()).isEqualTo(BookingStatus.CONFIRMED);

        // a second manager still looking at version 1
        assertThatThrownBy(() -> store.updateBookingStatusWithVersion(booking.getId(), 1L, BookingStatus.CANCELED))
                .isInstanceOf(ConcurrentBookingModificationException.class);
        assertThat(store.getBooking(booking.getId())).get()
                .extracting(Booking::getStatus).isEqualTo(BookingStatus.CONFIRMED);
    }

    @Test
    void forbiddenTransitionIsAValidationError() {
        Booking booking = store.createBookingWithLock(draft(camera, DAY, BookingStatus.PENDING));

        assertThatThrownBy(() -> store.updateBookingStatusWithVersion(booking.getId(), 1L, BookingStatus.COMPLETED))
                .isInstanceOf(ValidationException.class);
        assertThat(store.getBooking(booking.getId())).get().extracting(Booking::getVersion).isEqualTo(1L);
    }

    @Test
    void unknownBookingIsNotFound() {
        assertThatThrownBy(() -> store.updateBookingStatusWithVersion(999L, 1L, BookingStatus.CONFIRMED))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void itemChangeMovesTheUnitToTheNewItem() {
        Booking booking = store.createBookingWithLock(draft(camera, DAY, BookingStatus.PENDING));

        Booking moved = store.updateBookingItemAndStatusWithVersion(booking.getId(), 1L, drone.getId(), null,
                BookingStatus.CHANGED);

        assertThat(moved.getItemId()).isEqualTo(drone.getId());
        assertThat(moved.getItemName()).isEqualTo("DJI Mini");
        assertThat(moved.getStatus()).isEqualTo(BookingStatus.CHANGED);
        assertThat(moved.getVersion()).isEqualTo(2L);
        assertThat(store.bookedCount(camera.getId(), DAY)).isZero();
        assertThat(store.bookedCount(drone.getId(), DAY)).isEqualTo(1L);
    }

    @Test
    void itemChangeToSaturatedItemFails() {
        Booking booking = store.createBookingWithLock(draft(drone, DAY, BookingStatus.PENDING));
        store.createBookingWithLock(draft(camera, DAY, BookingStatus.CONFIRMED));

        assertThat(store.getBookingWithAvailability(booking.getId(), camera.getId()).available()).isFalse();
        assertThatThrownBy(() -> store.updateBookingItemAndStatusWithVersion(booking.getId(), 1L, camera.getId(),
                null, BookingStatus.CHANGED)).isInstanceOf(NotAvailableException.class);
    }

    @Test
    void rangeQueriesGroupByDay() {
        store.createBookingWithLock(draft(drone, DAY, BookingStatus.PENDING));
        store.createBookingWithLock(draft(drone, DAY.plusDays(2), BookingStatus.CONFIRMED));
        store.createBookingWithLock(draft(camera, DAY.plusDays(2), BookingStatus.CONFIRMED));

        Map<LocalDate, List<Booking>> daily = store.dailyBookingsInRange(DAY, DAY.plusDays(5));
        assertThat(daily).containsOnlyKeys(DAY, DAY.plusDays(2));
        assertThat(daily.get(DAY.plusDays(2))).hasSize(2);
        assertThat(store.bookedCountsPerDay(drone.getId(), DAY, DAY.plusDays(5)))
                .containsEntry(DAY, 1L)
                .containsEntry(DAY.plusDays(2), 1L);
        assertThat(store.maxDailyActiveCount(drone.getId(), DAY)).isEqualTo(1L);
    }

    static Booking draft(Item item, LocalDate date, BookingStatus status) {
        Booking b = new Booking();
        b.setUserId(42L);
        b.setUserName("Анна");
        b.setPhone("79991234567");
        b.setItemId(item.getId());
        b.setDate(date);
        b.setStatus(status);
        return b;
    }
}
