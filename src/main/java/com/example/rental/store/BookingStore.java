package com.example.rental.store;

import com.example.rental.dto.BookingWithAvailability;
import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.model.Item;
import com.example.rental.repository.BookingRepository;
import com.example.rental.repository.ItemRepository;
import com.example.rental.service.exception.ConcurrentBookingModificationException;
import com.example.rental.service.exception.NotAvailableException;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.exception.StorageException;
import com.example.rental.service.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Persistence of bookings. Capacity checks and inserts for an item run under a row lock
 * on that item, so {@code count(active bookings for item, date) <= total_quantity} holds
 * under concurrent requests. Mutations are optimistic on {@link Booking#getVersion()}.
 */
@Slf4j
@Component
public class BookingStore extends AbstractStore {

    static final int MAX_LOCK_ATTEMPTS = 3;

    private final BookingRepository bookingRepo;
    private final ItemRepository itemRepo;

    public BookingStore(BookingRepository bookingRepo, ItemRepository itemRepo,
                        PlatformTransactionManager txManager, Clock clock) {
        super(txManager, clock);
        this.bookingRepo = bookingRepo;
        this.itemRepo = itemRepo;
    }

    public Optional<Booking> getBooking(Long id) {
        return read("getBooking", () -> bookingRepo.findById(id));
    }

    /** Inclusive range, sorted by date then id. */
    public List<Booking> listBookingsInRange(LocalDate start, LocalDate end) {
        return read("listBookingsInRange", () -> bookingRepo.findByDateBetweenOrderByDateAscIdAsc(start, end));
    }

    public Map<LocalDate, List<Booking>> dailyBookingsInRange(LocalDate start, LocalDate end) {
        Map<LocalDate, List<Booking>> daily = new TreeMap<>();
        for (Booking b : listBookingsInRange(start, end)) {
            daily.computeIfAbsent(b.getDate(), d -> new ArrayList<>()).add(b);
        }
        return daily;
    }

    public long bookedCount(Long itemId, LocalDate date) {
        return read("bookedCount", () -> bookingRepo.countByItemAndDate(itemId, date, BookingStatus.ACTIVE));
    }

    /** Active bookings per day for the item; days without bookings are absent. */
    public Map<LocalDate, Long> bookedCountsPerDay(Long itemId, LocalDate start, LocalDate end) {
        return read("bookedCountsPerDay", () -> {
            Map<LocalDate, Long> result = new HashMap<>();
            for (Object[] row : bookingRepo.countPerDay(itemId, start, end, BookingStatus.ACTIVE)) {
                result.put((LocalDate) row[0], ((Number) row[1]).longValue());
            }
            return result;
        });
    }

    public List<Booking> userBookings(Long userId, LocalDate since) {
        return read("userBookings",
                () -> bookingRepo.findByUserIdAndDateGreaterThanEqualOrderByDateAscIdAsc(userId, since));
    }

    public List<Booking> bookingsOnDate(LocalDate date, Collection<BookingStatus> statuses) {
        return read("bookingsOnDate", () -> bookingRepo.findByDateAndStatusInOrderByIdAsc(date, statuses));
    }

    /**
     * Inserts the booking with version 1 if the item still has a free unit on that date.
     *
     * @throws NotAvailableException when the date is saturated
     * @throws ConcurrentBookingModificationException when the lock could not be taken
     */
    public Booking createBookingWithLock(Booking booking) {
        for (int attempt = 1; ; attempt++) {
            try {
                return tx.execute(status -> insertLocked(booking));
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                if (attempt >= MAX_LOCK_ATTEMPTS) {
                    log.warn("createBookingWithLock gave up for item={} date={} after {} attempts: {}",
                            booking.getItemId(), booking.getDate(), attempt, e.getMessage());
                    throw new ConcurrentBookingModificationException(
                            "Could not lock item " + booking.getItemId() + " for booking");
                }
                log.debug("createBookingWithLock retry {} for item={}: {}", attempt, booking.getItemId(), e.getMessage());
            } catch (DataAccessException e) {
                throw new StorageException("createBookingWithLock failed", e);
            }
        }
    }

    private Booking insertLocked(Booking booking) {
        Item item = itemRepo.findByIdForUpdate(booking.getItemId())
                .filter(Item::isActive)
                .orElseThrow(() -> new NotFoundException("Item", booking.getItemId()));

        long booked = bookingRepo.countByItemAndDate(item.getId(), booking.getDate(), BookingStatus.ACTIVE);
        if (booked >= item.getTotalQuantity()) {
            throw new NotAvailableException(item.getId(), booking.getDate());
        }

        LocalDateTime now = now();
        Booking copy = new Booking();
        copy.setUserId(booking.getUserId());
        copy.setUserName(booking.getUserName());
        copy.setUserNickname(booking.getUserNickname());
        copy.setPhone(booking.getPhone());
        copy.setItemId(item.getId());
        copy.setItemName(booking.getItemName() != null ? booking.getItemName() : item.getName());
        copy.setDate(booking.getDate());
        copy.setStatus(booking.getStatus() != null ? booking.getStatus() : BookingStatus.PENDING);
        copy.setComment(booking.getComment());
        copy.setVersion(1);
        copy.setCreatedAt(now);
        copy.setUpdatedAt(now);
        return bookingRepo.saveAndFlush(copy);
    }

    /**
     * Moves the booking to {@code newStatus} if it is still at {@code expectedVersion} and
     * the transition is allowed from its current status.
     */
    public Booking updateBookingStatusWithVersion(Long id, long expectedVersion, BookingStatus newStatus) {
        return versioned("updateBookingStatusWithVersion", () -> {
            int updated = bookingRepo.updateStatusWithVersion(
                    id, expectedVersion, BookingStatus.sourcesOf(newStatus), newStatus, now());
            if (updated == 0) {
                throw explainRejectedUpdate(id, expectedVersion, newStatus);
            }
            return bookingRepo.findById(id).orElseThrow(() -> new NotFoundException("Booking", id));
        });
    }

    /**
     * Reassigns the booking to another item. The target item is locked and its capacity
     * rechecked in the same transaction.
     */
    public Booking updateBookingItemAndStatusWithVersion(Long id, long expectedVersion, Long newItemId,
                                                         String newItemName, BookingStatus newStatus) {
        return versioned("updateBookingItemAndStatusWithVersion", () -> {
            Item item = itemRepo.findByIdForUpdate(newItemId)
                    .filter(Item::isActive)
                    .orElseThrow(() -> new NotFoundException("Item", newItemId));
            Booking current = bookingRepo.findById(id).orElseThrow(() -> new NotFoundException("Booking", id));
            if (!hasRoom(current, item)) {
                throw new NotAvailableException(newItemId, current.getDate());
            }

            int updated = bookingRepo.updateItemAndStatusWithVersion(id, expectedVersion,
                    BookingStatus.sourcesOf(newStatus), newItemId,
                    newItemName != null ? newItemName : item.getName(), newStatus, now());
            if (updated == 0) {
                throw explainRejectedUpdate(id, expectedVersion, newStatus);
            }
            return bookingRepo.findById(id).orElseThrow(() -> new NotFoundException("Booking", id));
        });
    }

    public BookingWithAvailability getBookingWithAvailability(Long id, Long newItemId) {
        return read("getBookingWithAvailability", () -> {
            Booking booking = bookingRepo.findById(id).orElseThrow(() -> new NotFoundException("Booking", id));
            Item item = itemRepo.findById(newItemId).orElseThrow(() -> new NotFoundException("Item", newItemId));
            return new BookingWithAvailability(booking, item.isActive() && hasRoom(booking, item));
        });
    }

    /** Highest number of active bookings on any day from {@code from} on. */
    public long maxDailyActiveCount(Long itemId, LocalDate from) {
        return read("maxDailyActiveCount", () -> {
            List<Long> counts = bookingRepo.findDailyCountsDesc(itemId, from, BookingStatus.ACTIVE);
            return counts.isEmpty() ? 0L : counts.get(0);
        });
    }

    private Booking versioned(String operation, Supplier<Booking> work) {
        try {
            return tx.execute(status -> work.get());
        } catch (ConcurrencyFailureException e) {
            throw new ConcurrentBookingModificationException(operation + " lost a lock race: " + e.getMessage());
        } catch (DataAccessException e) {
            throw new StorageException(operation + " failed", e);
        }
    }

    private boolean hasRoom(Booking booking, Item target) {
        long booked = bookingRepo.countByItemAndDate(target.getId(), booking.getDate(), BookingStatus.ACTIVE);
        if (target.getId().equals(booking.getItemId()) && booking.getStatus().isActive()) {
            booked--; // the booking already holds a unit of this item
        }
        return booked < target.getTotalQuantity();
    }

    private RuntimeException explainRejectedUpdate(Long id, long expectedVersion, BookingStatus target) {
        Booking current = bookingRepo.findById(id).orElse(null);
        if (current == null) {
            return new NotFoundException("Booking", id);
        }
        if (current.getVersion() != expectedVersion) {
            return new ConcurrentBookingModificationException(
                    "Booking " + id + " is at version " + current.getVersion() + ", expected " + expectedVersion);
        }
        return new ValidationException("Нельзя перевести заявку из статуса «%s» в «%s»."
                .formatted(current.getStatus().label(), target.label()));
    }
}
