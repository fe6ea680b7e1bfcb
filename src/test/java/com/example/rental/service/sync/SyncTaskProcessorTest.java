package com.example.rental.service.sync;

import com.example.rental.controllers.impl.InMemoryMirrorSink;
import com.example.rental.dto.BookingDTO;
import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.model.SyncTask;
import com.example.rental.model.SyncTaskType;
import com.example.rental.service.ItemService;
import com.example.rental.service.UserService;
import com.example.rental.store.BookingStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

class SyncTaskProcessorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 6, 10);

    private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
    private InMemoryMirrorSink sink;
    private BookingStore bookingStore;
    private ItemService itemService;
    private SyncTaskProcessor processor;

    @BeforeEach
    void setUp() {
        sink = new InMemoryMirrorSink();
        bookingStore = Mockito.mock(BookingStore.class);
        itemService = Mockito.mock(ItemService.class);
        UserService userService = Mockito.mock(UserService.class);
        processor = new SyncTaskProcessor(sink, bookingStore, itemService, userService, mapper,
                Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void upsertFromSnapshotIsIdempotent() throws Exception {
        String snapshot = mapper.writeValueAsString(BookingDTO.from(booking(10L, BookingStatus.PENDING)));

        processor.process(task(SyncTaskType.UPSERT, 10L, snapshot, "pending"));
        processor.process(task(SyncTaskType.UPSERT, 10L, snapshot, "pending"));

        assertThat(sink.bookings()).hasSize(1);
        assertThat(sink.booking(10L)).get().extracting(BookingDTO::getDate).isEqualTo(DAY);
    }

    @Test
    void unreadableSnapshotFallsBackToTheStoredBooking() {
        when(bookingStore.getBooking(10L)).thenReturn(Optional.of(booking(10L, BookingStatus.CONFIRMED)));

        processor.process(task(SyncTaskType.UPSERT, 10L, "{not json", "confirmed"));

        assertThat(sink.booking(10L)).get().extracting(BookingDTO::getStatus).isEqualTo("confirmed");
    }

    @Test
    void upsertOfVanishedBookingIsNotRetryable() {
        when(bookingStore.getBooking(10L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> processor.process(task(SyncTaskType.UPSERT, 10L, null, "pending")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusUpdateNeedsAStatus() {
        assertThatThrownBy(() -> processor.process(task(SyncTaskType.UPDATE_STATUS, 10L, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusUpdatePatchesTheMirroredRow() throws Exception {
        processor.process(task(SyncTaskType.UPSERT, 10L,
                mapper.writeValueAsString(BookingDTO.from(booking(10L, BookingStatus.PENDING))), "pending"));

        processor.process(task(SyncTaskType.UPDATE_STATUS, 10L, null, "confirmed"));

        assertThat(sink.booking(10L)).get().extracting(BookingDTO::getStatus).isEqualTo("confirmed");
    }

    @Test
    void scheduleOnlyShowsActiveBookings() throws Exception {
        ScheduleWindow window = new ScheduleWindow(DAY.minusDays(1), DAY.plusDays(1));
        Map<LocalDate, List<Booking>> daily = new TreeMap<>();
        daily.put(DAY, List.of(booking(1L, BookingStatus.CONFIRMED), booking(2L, BookingStatus.CANCELED)));
        daily.put(DAY.plusDays(1), List.of(booking(3L, BookingStatus.COMPLETED)));
        when(bookingStore.dailyBookingsInRange(window.start(), window.end())).thenReturn(daily);
        when(itemService.listActive()).thenReturn(List.of());

        processor.process(task(SyncTaskType.SYNC_SCHEDULE, null, mapper.writeValueAsString(window), null));

        assertThat(sink.schedule()).containsOnlyKeys(DAY);
        assertThat(sink.schedule().get(DAY)).extracting(BookingDTO::getId).containsExactly(1L);
    }

    private static Booking booking(Long id, BookingStatus status) {
        Booking b = new Booking();
        b.setId(id);
        b.setUserId(42L);
        b.setUserName("Анна");
        b.setItemId(1L);
        b.setItemName("Canon R6");
        b.setDate(DAY);
        b.setStatus(status);
        return b;
    }

    private static SyncTask task(SyncTaskType type, Long bookingId, String payload, String status) {
        SyncTask task = SyncTask.create(type, bookingId, payload, status, LocalDateTime.of(2025, 6, 1, 10, 0));
        task.setId(1L);
        return task;
    }
}
