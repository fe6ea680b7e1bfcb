package com.example.rental.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Configuration
@Data
@PropertySource("classpath:application.properties")
public class BotConfig {

    @Value("${bot.name:rental_bot}")
    String botName;

    @Value("${bot.token:}")
    String token;

    @Value("${bot.enabled:true}")
    boolean enabled = true;

    @Value("${bot.timezone:Europe/Moscow}")
    String timezone = "Europe/Moscow";

    @Value("${bot.rate_limit_messages:20}")
    int rateLimitMessages = 20;

    /** seconds */
    @Value("${bot.rate_limit_window:60}")
    int rateLimitWindow = 60;

    @Value("${bot.max_booking_days:365}")
    int maxBookingDays = 365;

    @Value("${bot.min_booking_advance_hours:0}")
    int minBookingAdvanceHours;

    @Value("${bot.pagination_size:8}")
    int paginationSize = 8;

    @Value("${bot.bookings_pagination_size:5}")
    int bookingsPaginationSize = 5;

    @Value("${bot.reminder_time:09:00}")
    String reminderTime = "09:00";

    @Value("${bot.update_workers:8}")
    int updateWorkers = 8;

    @Value("${bot.update_queue_capacity:500}")
    int updateQueueCapacity = 500;

    @Value("${managers:}")
    List<Long> managers = new ArrayList<>();

    @Value("${blacklist:}")
    List<Long> blacklist = new ArrayList<>();

    @Value("${managers_contacts:}")
    List<String> managersContacts = new ArrayList<>();

    @Value("${exports.path:./exports}")
    String exportsPath = "./exports";

    public LocalTime reminderLocalTime() {
        try {
            return LocalTime.parse(reminderTime);
        } catch (Exception e) {
            return LocalTime.of(9, 0);
        }
    }
}
