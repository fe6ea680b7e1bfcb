package com.example.rental.service;

import com.example.rental.config.BotConfig;
import com.example.rental.model.Booking;
import com.example.rental.service.util.DateInputParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Once a day, after {@code bot.reminder_time}, reminds owners of tomorrow's confirmed bookings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderScheduler {

    private final BookingService bookingService;
    private final ChatSender sender;
    private final BotConfig config;
    private final Clock clock;

    private final AtomicReference<LocalDate> lastRun = new AtomicReference<>();

    @Scheduled(fixedDelay = 60_000)
    public void checkReminders() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        if (now.toLocalTime().isBefore(config.reminderLocalTime()) || today.equals(lastRun.get())) {
            return;
        }
        try {
            int sent = sendReminders(today);
            lastRun.set(today);
            log.info("Reminders for {} sent: {}", today.plusDays(1), sent);
        } catch (Exception e) {
            // lastRun stays unset, the next tick tries again
            log.error("Reminder run failed: {}", e.getMessage(), e);
        }
    }

    /** @return number of reminders handed to the chat sender */
    public int sendReminders(LocalDate today) {
        LocalDate tomorrow = today.plusDays(1);
        List<Booking> bookings = bookingService.bookingsToRemind(tomorrow);
        int sent = 0;
        for (Booking b : bookings) {
            if (b.getUserId() == null) continue;
            String text = "🔔 Напоминание: завтра у вас бронь %s на %s. Статус: %s."
                    .formatted(b.getItemName(), DateInputParser.format(b.getDate()), b.getStatus().label());
            if (sender.sendText(b.getUserId(), text).isPresent()) {
                sent++;
            }
        }
        return sent;
    }
}
