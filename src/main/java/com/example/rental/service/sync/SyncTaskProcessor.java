package com.example.rental.service.sync;

import com.example.rental.controllers.MirrorSink;
import com.example.rental.dto.BookingDTO;
import com.example.rental.dto.ItemDTO;
import com.example.rental.dto.UserDTO;
import com.example.rental.model.Booking;
import com.example.rental.model.SyncTask;
import com.example.rental.service.ItemService;
import com.example.rental.service.UserService;
import com.example.rental.store.BookingStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one outbox row into mirror writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncTaskProcessor {

    private final MirrorSink sink;
    private final BookingStore bookingStore;
    private final ItemService itemService;
    private final UserService userService;
    private final ObjectMapper mapper;
    private final Clock clock;

    /**
     * @throws com.example.rental.service.exception.RemoteSinkException when the mirror write fails
     * @throws IllegalArgumentException when the row cannot be interpreted; retrying will not help
     */
    public void process(SyncTask task) {
        switch (task.getTaskType()) {
            case UPSERT -> sink.upsertBooking(bookingSnapshot(task));
            case UPDATE_STATUS -> {
                if (task.getBookingId() == null || task.getBookingStatus() == null) {
                    throw new IllegalArgumentException("update_status task " + task.getId() + " lacks booking id or status");
                }
                sink.updateBookingStatus(task.getBookingId(), task.getBookingStatus());
            }
            case SYNC_SCHEDULE -> syncSchedule(window(task));
            case REPLACE_BOOKINGS -> {
                ScheduleWindow w = window(task);
                List<BookingDTO> rows = bookingStore.listBookingsInRange(w.start(), w.end()).stream()
                        .map(BookingDTO::from)
                        .toList();
                sink.replaceBookingsSheet(rows);
            }
            case SYNC_USERS -> sink.updateUsersSheet(userService.allUsers().stream().map(UserDTO::from).toList());
        }
    }

    private void syncSchedule(ScheduleWindow w) {
        Map<LocalDate, List<BookingDTO>> daily = new LinkedHashMap<>();
        bookingStore.dailyBookingsInRange(w.start(), w.end()).forEach((date, bookings) -> {
            List<BookingDTO> active = bookings.stream()
                    .filter(b -> b.getStatus().isActive())
                    .map(BookingDTO::from)
                    .toList();
            if (!active.isEmpty()) {
                daily.put(date, active);
            }
        });
        List<ItemDTO> items = itemService.listActive().stream().map(ItemDTO::from).toList();
        sink.updateScheduleSheet(w.start(), w.end(), daily, items);
    }

    private BookingDTO bookingSnapshot(SyncTask task) {
        if (task.getPayload() != null && !task.getPayload().isBlank()) {
            try {
                return mapper.readValue(task.getPayload(), BookingDTO.class);
            } catch (JsonProcessingException e) {
                log.warn("Bad booking snapshot in task {}, reloading booking {}: {}",
                        task.getId(), task.getBookingId(), e.getMessage());
            }
        }
        if (task.getBookingId() == null) {
            throw new IllegalArgumentException("upsert task " + task.getId() + " has neither snapshot nor booking id");
        }
        Booking booking = bookingStore.getBooking(task.getBookingId())
                .orElseThrow(() -> new IllegalArgumentException("Booking " + task.getBookingId() + " is gone"));
        return BookingDTO.from(booking);
    }

    private ScheduleWindow window(SyncTask task) {
        if (task.getPayload() != null && !task.getPayload().isBlank()) {
            try {
                ScheduleWindow w = mapper.readValue(task.getPayload(), ScheduleWindow.class);
                if (w.start() != null && w.end() != null) return w;
            } catch (JsonProcessingException e) {
                log.warn("Bad schedule window in task {}: {}", task.getId(), e.getMessage());
            }
        }
        return ScheduleWindow.around(LocalDate.now(clock));
    }
}
