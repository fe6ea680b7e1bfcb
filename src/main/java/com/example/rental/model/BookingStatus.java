package com.example.rental.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Booking lifecycle. Statuses in {@link #ACTIVE} hold a unit of the item's daily capacity.
 */
public enum BookingStatus {
    PENDING("pending", "⏳ Ожидает"),
    CONFIRMED("confirmed", "✅ Подтверждено"),
    CHANGED("changed", "🔄 Изменено"),
    RESCHEDULED("rescheduled", "📅 Перенос"),
    CANCELED("canceled", "❌ Отменено"),
    COMPLETED("completed", "🏁 Завершено");

    public static final Set<BookingStatus> ACTIVE = EnumSet.of(PENDING, CONFIRMED, CHANGED, RESCHEDULED);

    private static final Map<BookingStatus, Set<BookingStatus>> TRANSITIONS = Map.of(
            PENDING, EnumSet.of(CONFIRMED, CANCELED, CHANGED, RESCHEDULED),
            CONFIRMED, EnumSet.of(COMPLETED, PENDING, CHANGED, RESCHEDULED),
            CHANGED, EnumSet.of(CONFIRMED, CANCELED),
            RESCHEDULED, EnumSet.of(CONFIRMED, CANCELED),
            CANCELED, EnumSet.noneOf(BookingStatus.class),
            COMPLETED, EnumSet.noneOf(BookingStatus.class)
    );

    private final String code;
    private final String label;

    BookingStatus(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean canTransitionTo(BookingStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /** Statuses from which {@code target} is reachable. */
    public static Set<BookingStatus> sourcesOf(BookingStatus target) {
        Set<BookingStatus> result = EnumSet.noneOf(BookingStatus.class);
        for (BookingStatus s : values()) {
            if (s.canTransitionTo(target)) result.add(s);
        }
        return result;
    }

    public static BookingStatus fromCode(String code) {
        for (BookingStatus s : values()) {
            if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("Unknown booking status: " + code);
    }
}
