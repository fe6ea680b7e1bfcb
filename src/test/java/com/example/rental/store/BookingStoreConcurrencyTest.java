package com.example.rental.store;

import com.example.rental.model.BookingStatus;
import com.example.rental.model.Item;
import com.example.rental.repository.BookingRepository;
import com.example.rental.repository.ItemRepository;
import com.example.rental.service.exception.BookingException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/** Runs without the test transaction so every store call commits on its own thread. */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class BookingStoreConcurrencyTest {

    @Autowired
    private BookingRepository bookingRepo;
    @Autowired
    private ItemRepository itemRepo;
    @Autowired
    private PlatformTransactionManager txManager;

    private BookingStore store;
    private Item camera;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T07:00:00Z"), ZoneId.of("Europe/Moscow"));
        store = new BookingStore(bookingRepo, itemRepo, txManager, clock);
        camera = new ItemStore(itemRepo, bookingRepo, txManager, clock).createItem("Canon R6", null, 1);
    }

    @AfterEach
    void cleanUp() {
        bookingRepo.deleteAll();
        itemRepo.deleteAll();
    }

    @Test
    void lastUnitGoesToExactlyOneOfManyRacingRequests() throws Exception {
        int requests = 8;
        ExecutorService pool = Executors.newFixedThreadPool(requests);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < requests; i++) {
            Callable<Boolean> attempt = () -> {
                start.await();
                try {
                    store.createBookingWithLock(BookingStoreTest.draft(camera, BookingStoreTest.DAY, BookingStatus.PENDING));
                    return true;
                } catch (BookingException e) {
                    return false;
                }
            };
            results.add(pool.submit(attempt));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(30, TimeUnit.SECONDS)) winners++;
        }
        pool.shutdown();

        assertThat(winners).isEqualTo(1);
        assertThat(store.bookedCount(camera.getId(), BookingStoreTest.DAY)).isEqualTo(1L);
    }
}
