package com.example.rental.store;

import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.model.Item;
import com.example.rental.repository.BookingRepository;
import com.example.rental.repository.ItemRepository;
import com.example.rental.service.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class ItemStoreTest {

    @Autowired
    private ItemRepository itemRepo;
    @Autowired
    private BookingRepository bookingRepo;
    @Autowired
    private PlatformTransactionManager txManager;

    private ItemStore items;
    private BookingStore bookings;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T07:00:00Z"), ZoneId.of("Europe/Moscow"));
        items = new ItemStore(itemRepo, bookingRepo, txManager, clock);
        bookings = new BookingStore(bookingRepo, itemRepo, txManager, clock);
    }

    @Test
    void newItemsGoToTheEndOfTheList() {
        Item first = items.createItem("Canon R6", "Полнокадровая", 1);
        Item second = items.createItem("DJI Mini", null, 2);

        assertThat(second.getSortOrder()).isEqualTo(first.getSortOrder() + 1);
        assertThat(items.listActiveItemsSorted()).extracting(Item::getName).containsExactly("Canon R6", "DJI Mini");
    }

    @Test
    void reorderChangesListingAndNeverGoesBelowOne() {
        items.createItem("Canon R6", null, 1);
        Item drone = items.createItem("DJI Mini", null, 1);

        assertThat(items.reorderItem(drone.getId(), -5).getSortOrder()).isEqualTo(1);
        // equal order falls back to name
        assertThat(items.listActiveItemsSorted()).extracting(Item::getName).containsExactly("Canon R6", "DJI Mini");

        Item gopro = items.createItem("GoPro", null, 1);
        items.reorderItem(gopro.getId(), 1);
        items.reorderItem(items.getItemByName("Canon R6").orElseThrow().getId(), 7);
        assertThat(items.listActiveItemsSorted()).extracting(Item::getName)
                .containsExactly("DJI Mini", "GoPro", "Canon R6");
    }

    @Test
    void lookupByNameIgnoresCaseAndInactiveItems() {
        Item camera = items.createItem("Canon R6", null, 1);
        assertThat(items.getItemByName("canon r6")).get().extracting(Item::getId).isEqualTo(camera.getId());

        items.deactivateItem(camera.getId());

        assertThat(items.getItemByName("Canon R6")).isEmpty();
        assertThat(items.listActiveItemsSorted()).isEmpty();
        assertThat(items.getItemById(camera.getId())).isPresent();
    }

    @Test
    void capacityCannotDropBelowTheBusiestFutureDay() {
        Item drone = items.createItem("DJI Mini", null, 3);
        bookings.createBookingWithLock(BookingStoreTest.draft(drone, BookingStoreTest.DAY, BookingStatus.PENDING));
        bookings.createBookingWithLock(BookingStoreTest.draft(drone, BookingStoreTest.DAY, BookingStatus.CONFIRMED));
        Booking canceled = bookings.createBookingWithLock(
                BookingStoreTest.draft(drone, BookingStoreTest.DAY, BookingStatus.PENDING));
        bookings.updateBookingStatusWithVersion(canceled.getId(), 1L, BookingStatus.CANCELED);

        assertThat(items.updateItem(drone.getId(), null, null, 2).getTotalQuantity()).isEqualTo(2);
        assertThatThrownBy(() -> items.updateItem(drone.getId(), null, null, 1))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void duplicateActiveNameIsRejected() {
        items.createItem("Canon R6", null, 1);

        assertThatThrownBy(() -> items.createItem("CANON R6", null, 1)).isInstanceOf(ValidationException.class);
    }
}
