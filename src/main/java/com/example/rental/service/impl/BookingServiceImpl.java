package com.example.rental.service.impl;

import com.example.rental.config.BotConfig;
import com.example.rental.dto.Actor;
import com.example.rental.dto.BookingDTO;
import com.example.rental.dto.BookingWithAvailability;
import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.model.Item;
import com.example.rental.model.SyncTaskType;
import com.example.rental.service.BookingService;
import com.example.rental.service.BotMetrics;
import com.example.rental.service.ItemService;
import com.example.rental.service.event.BookingEventPayload;
import com.example.rental.service.event.DomainEventBus;
import com.example.rental.service.event.EventType;
import com.example.rental.service.exception.DateTooFarException;
import com.example.rental.service.exception.NotAvailableException;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.exception.PastDateException;
import com.example.rental.service.sync.ScheduleWindow;
import com.example.rental.store.BookingStore;
import com.example.rental.store.SyncQueueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookingServiceImpl implements BookingService {

    private static final int USER_HISTORY_DAYS = 14;

    private final BookingStore bookingStore;
    private final SyncQueueStore syncQueue;
    private final ItemService itemService;
    private final DomainEventBus eventBus;
    private final BotMetrics metrics;
    private final ObjectMapper mapper;
    private final BotConfig config;
    private final Clock clock;

    @Override
    public void validateDate(LocalDate date) {
        LocalDate today = LocalDate.now(clock);
        int advanceHours = config.getMinBookingAdvanceHours();
        if (advanceHours > 0) {
            ZonedDateTime dayStart = date.atStartOfDay(clock.getZone());
            ZonedDateTime earliest = ZonedDateTime.now(clock).plusHours(advanceHours);
            if (dayStart.isBefore(earliest)) {
                throw new PastDateException(date);
            }
        } else if (date.isBefore(today)) {
            throw new PastDateException(date);
        }

        int maxDays = config.getMaxBookingDays() > 0 ? config.getMaxBookingDays() : 365;
        if (date.isAfter(today.plusDays(maxDays))) {
            throw new DateTooFarException(date, maxDays);
        }
    }

    @Override
    public boolean checkAvailability(Long itemId, LocalDate date) {
        Item item = itemService.findById(itemId).orElseThrow(() -> new NotFoundException("Item", itemId));
        return bookingStore.bookedCount(itemId, date) < item.getTotalQuantity();
    }

    @Override
    public long bookedCount(Long itemId, LocalDate date) {
        return bookingStore.bookedCount(itemId, date);
    }

    @Override
    public Map<LocalDate, Long> availabilityForPeriod(Long itemId, LocalDate start, int days) {
        LocalDate end = start.plusDays(Math.max(days, 1) - 1L);
        Map<LocalDate, Long> counts = bookingStore.bookedCountsPerDay(itemId, start, end);
        Map<LocalDate, Long> result = new LinkedHashMap<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            result.put(d, counts.getOrDefault(d, 0L));
        }
        return result;
    }

    @Override
    public Booking createBooking(Booking draft) {
        draft.setStatus(BookingStatus.PENDING);
        Booking created = create(draft);
        metrics.bookingCreated("user");
        publish(EventType.BOOKING_CREATED, created, new Actor(created.getUserId(), created.getUserName()));
        afterCreate(created);
        return created;
    }

    @Override
    public Booking createManagerBooking(Booking draft, Actor manager) {
        draft.setStatus(BookingStatus.CONFIRMED);
        Booking created = create(draft);
        metrics.bookingCreated("manager");
        publish(EventType.BOOKING_CREATED, created, manager);
        afterCreate(created);
        return created;
    }

    private Booking create(Booking draft) {
        validateDate(draft.getDate());
        if (!checkAvailability(draft.getItemId(), draft.getDate())) {
            throw new NotAvailableException(draft.getItemId(), draft.getDate());
        }
        Booking created = bookingStore.createBookingWithLock(draft);
        log.info("Booking {} created: item={} date={} status={} user={}", created.getId(),
                created.getItemId(), created.getDate(), created.getStatus().code(), created.getUserId());
        return created;
    }

    private void afterCreate(Booking created) {
        enqueue(SyncTaskType.UPSERT, created.getId(), BookingDTO.from(created), created.getStatus().code());
        requestScheduleSync();
    }

    @Override
    public Booking confirm(Long id, long version, Actor manager) {
        return transition(id, version, BookingStatus.CONFIRMED, EventType.BOOKING_CONFIRMED, manager);
    }

    @Override
    public Booking reject(Long id, long version, Actor manager) {
        return transition(id, version, BookingStatus.CANCELED, EventType.BOOKING_CANCELED, manager);
    }

    @Override
    public Booking complete(Long id, long version, Actor manager) {
        return transition(id, version, BookingStatus.COMPLETED, EventType.BOOKING_COMPLETED, manager);
    }

    @Override
    public Booking reopen(Long id, long version, Actor manager) {
        return transition(id, version, BookingStatus.PENDING, null, manager);
    }

    @Override
    public Booking reschedule(Long id, long version, Actor manager) {
        return transition(id, version, BookingStatus.RESCHEDULED, null, manager);
    }

    private Booking transition(Long id, long version, BookingStatus target, EventType event, Actor manager) {
        Booking updated = bookingStore.updateBookingStatusWithVersion(id, version, target);
        log.info("Booking {} -> {} by {} (version {})", id, target.code(), manager.id(), updated.getVersion());
        if (event != null) {
            publish(event, updated, manager);
        }
        enqueue(SyncTaskType.UPDATE_STATUS, updated.getId(), null, updated.getStatus().code());
        requestScheduleSync();
        return updated;
    }

    @Override
    public Booking changeItem(Long id, long version, Long newItemId, Actor manager) {
        BookingWithAvailability current = bookingStore.getBookingWithAvailability(id, newItemId);
        if (!current.available()) {
            throw new NotAvailableException(newItemId, current.booking().getDate());
        }
        Item item = itemService.findById(newItemId).orElseThrow(() -> new NotFoundException("Item", newItemId));

        Booking updated = bookingStore.updateBookingItemAndStatusWithVersion(
                id, version, newItemId, item.getName(), BookingStatus.CHANGED);
        log.info("Booking {} moved to item {} by {}", id, newItemId, manager.id());

        publish(EventType.BOOKING_ITEM_CHANGED, updated, manager);
        // the item column changed too, a status patch is not enough
        enqueue(SyncTaskType.UPSERT, updated.getId(), BookingDTO.from(updated), updated.getStatus().code());
        requestScheduleSync();
        return updated;
    }

    @Override
    public Optional<Booking> findBooking(Long id) {
        return bookingStore.getBooking(id);
    }

    @Override
    public List<Booking> bookingsInRange(LocalDate start, LocalDate end) {
        return bookingStore.listBookingsInRange(start, end);
    }

    @Override
    public List<Booking> userBookings(Long userId) {
        return bookingStore.userBookings(userId, LocalDate.now(clock).minusDays(USER_HISTORY_DAYS));
    }

    @Override
    public List<Booking> bookingsToRemind(LocalDate date) {
        return bookingStore.bookingsOnDate(date, EnumSet.of(BookingStatus.CONFIRMED, BookingStatus.CHANGED));
    }

    @Override
    public void requestScheduleSync() {
        enqueue(SyncTaskType.SYNC_SCHEDULE, null, ScheduleWindow.around(LocalDate.now(clock)), null);
    }

    @Override
    public void requestBookingsResync() {
        enqueue(SyncTaskType.REPLACE_BOOKINGS, null, ScheduleWindow.around(LocalDate.now(clock)), null);
    }

    @Override
    public void requestUsersSync() {
        enqueue(SyncTaskType.SYNC_USERS, null, null, null);
    }

    private void publish(EventType type, Booking booking, Actor actor) {
        eventBus.publishJson(type, BookingEventPayload.of(booking, actor.name(), actor.id()));
    }

    /** The booking itself is already committed; a lost outbox row is logged and healed by a full resync. */
    private void enqueue(SyncTaskType type, Long bookingId, Object payload, String status) {
        try {
            String json = payload == null ? null : mapper.writeValueAsString(payload);
            syncQueue.enqueueTask(type, bookingId, json, status);
        } catch (JsonProcessingException e) {
            log.error("Cannot encode {} payload for booking {}: {}", type, bookingId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to enqueue {} for booking {} at {}: {}", type, bookingId,
                    LocalDateTime.now(clock), e.getMessage(), e);
        }
    }
}
