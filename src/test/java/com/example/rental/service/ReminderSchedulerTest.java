package com.example.rental.service;

import com.example.rental.config.BotConfig;
import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.service.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReminderSchedulerTest {

    private static final ZoneId MOSCOW = ZoneId.of("Europe/Moscow");
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 1);

    private BookingService bookingService;
    private ChatSender sender;
    private BotConfig config;

    @BeforeEach
    void setUp() {
        bookingService = Mockito.mock(BookingService.class);
        sender = Mockito.mock(ChatSender.class);
        config = new BotConfig();
        config.setReminderTime("09:00");
        when(sender.sendText(anyLong(), anyString())).thenReturn(Optional.of(1));
    }

    private ReminderScheduler at(String isoInstant) {
        return new ReminderScheduler(bookingService, sender, config, Clock.fixed(Instant.parse(isoInstant), MOSCOW));
    }

    private static Booking booking(long id, Long owner) {
        Booking b = new Booking();
        b.setId(id);
        b.setUserId(owner);
        b.setItemName("Canon R6");
        b.setDate(TODAY.plusDays(1));
        b.setStatus(BookingStatus.CONFIRMED);
        return b;
    }

    @Test
    void remindsOwnersOfTomorrowsBookings() {
        when(bookingService.bookingsToRemind(TODAY.plusDays(1)))
                .thenReturn(List.of(booking(1, 42L), booking(2, null), booking(3, 43L)));
        when(sender.sendText(eq(43L), anyString())).thenReturn(Optional.empty());

        int sent = at("2025-06-01T07:00:00Z").sendReminders(TODAY);

        assertThat(sent).isEqualTo(1);
        verify(sender).sendText(eq(42L), contains("завтра у вас бронь Canon R6 на 02.06.2025"));
    }

    @Test
    void runsOnceADayAfterTheConfiguredTime() {
        when(bookingService.bookingsToRemind(any())).thenReturn(List.of(booking(1, 42L)));

        // 08:30 Moscow
        at("2025-06-01T05:30:00Z").checkReminders();
        verify(bookingService, never()).bookingsToRemind(any());

        ReminderScheduler scheduler = at("2025-06-01T06:30:00Z");
        scheduler.checkReminders();
        scheduler.checkReminders();

        verify(bookingService, times(1)).bookingsToRemind(TODAY.plusDays(1));
        verify(sender, times(1)).sendText(eq(42L), anyString());
    }

    @Test
    void failedRunIsRetriedOnTheNextTick() {
        when(bookingService.bookingsToRemind(TODAY.plusDays(1)))
                .thenThrow(new StorageException("bookingsOnDate", new RuntimeException("db down")))
                .thenReturn(List.of(booking(1, 42L)));

        ReminderScheduler scheduler = at("2025-06-01T06:30:00Z");
        scheduler.checkReminders();
        verify(sender, never()).sendText(anyLong(), anyString());

        scheduler.checkReminders();
        scheduler.checkReminders();

        verify(bookingService, times(2)).bookingsToRemind(TODAY.plusDays(1));
        verify(sender, times(1)).sendText(eq(42L), anyString());
    }
}
