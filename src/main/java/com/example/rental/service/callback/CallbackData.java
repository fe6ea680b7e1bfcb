package com.example.rental.service.callback;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.example.rental.service.callback.CallbackAction.*;

/**
 * Wire format of inline button payloads, both directions. Payloads stay well under the
 * 64 byte Telegram limit.
 */
public final class CallbackData {
    private CallbackData() {}

    public static final String BACK_TO_MAIN_DATA = "back_to_main";
    public static final String BACK_TO_MAIN_FROM_SCHEDULE_DATA = "back_to_main_from_schedule";
    public static final String MANAGER_SINGLE_DATE_DATA = "manager_single_date";
    public static final String MANAGER_DATE_RANGE_DATA = "manager_date_range";
    public static final String EXPORT_USERS_DATA = "export_users";

    public static final String ITEMS_PAGE_PREFIX = "items_page:";
    public static final String SCHEDULE_ITEMS_PAGE_PREFIX = "schedule_items_page:";
    public static final String MANAGER_ITEMS_PAGE_PREFIX = "manager_items_page:";
    public static final String MANAGER_BOOKINGS_PAGE_PREFIX = "manager_bookings_page:";

    private static final Map<String, CallbackAction> EXACT = Map.of(
            BACK_TO_MAIN_DATA, BACK_TO_MAIN,
            BACK_TO_MAIN_FROM_SCHEDULE_DATA, BACK_TO_MAIN_FROM_SCHEDULE,
            MANAGER_SINGLE_DATE_DATA, MANAGER_SINGLE_DATE,
            MANAGER_DATE_RANGE_DATA, MANAGER_DATE_RANGE,
            EXPORT_USERS_DATA, EXPORT_USERS
    );

    // order matters: "change_to_" must be tried before "change_item_"
    private static final List<Map.Entry<String, CallbackAction>> PREFIXED = List.of(
            Map.entry(ITEMS_PAGE_PREFIX, ITEMS_PAGE),
            Map.entry("select_item:", SELECT_ITEM),
            Map.entry(SCHEDULE_ITEMS_PAGE_PREFIX, SCHEDULE_ITEMS_PAGE),
            Map.entry("schedule_select_item:", SCHEDULE_SELECT_ITEM),
            Map.entry("book_item:", BOOK_ITEM),
            Map.entry(MANAGER_ITEMS_PAGE_PREFIX, MANAGER_ITEMS_PAGE),
            Map.entry("manager_select_item:", MANAGER_SELECT_ITEM),
            Map.entry(MANAGER_BOOKINGS_PAGE_PREFIX, MANAGER_BOOKINGS_PAGE),
            Map.entry("call_booking:", CALL_BOOKING),
            Map.entry("show_booking:", SHOW_BOOKING),
            Map.entry("confirm_", CONFIRM),
            Map.entry("reject_", REJECT),
            Map.entry("reschedule_", RESCHEDULE),
            Map.entry("reopen_", REOPEN),
            Map.entry("complete_", COMPLETE),
            Map.entry("change_item_", CHANGE_ITEM)
    );

    private static final String CHANGE_TO_PREFIX = "change_to_";

    public static Optional<Callback> parse(String data) {
        if (data == null || data.isBlank()) return Optional.empty();
        String value = data.trim();

        CallbackAction exact = EXACT.get(value);
        if (exact != null) {
            return Optional.of(Callback.of(exact));
        }

        if (value.startsWith(CHANGE_TO_PREFIX)) {
            String[] parts = value.substring(CHANGE_TO_PREFIX.length()).split("_");
            if (parts.length != 2) return Optional.empty();
            Long bookingId = parseId(parts[0]);
            Long itemId = parseId(parts[1]);
            if (bookingId == null || itemId == null) return Optional.empty();
            return Optional.of(new Callback(CHANGE_TO, bookingId, itemId));
        }

        for (Map.Entry<String, CallbackAction> entry : PREFIXED) {
            if (value.startsWith(entry.getKey())) {
                Long id = parseId(value.substring(entry.getKey().length()));
                return id == null ? Optional.empty() : Optional.of(Callback.of(entry.getValue(), id));
            }
        }
        return Optional.empty();
    }

    private static Long parseId(String raw) {
        try {
            long v = Long.parseLong(raw);
            return v < 0 ? null : v;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String itemsPage(int page) {
        return ITEMS_PAGE_PREFIX + page;
    }

    public static String selectItem(long itemId) {
        return "select_item:" + itemId;
    }

    public static String scheduleSelectItem(long itemId) {
        return "schedule_select_item:" + itemId;
    }

    public static String bookItem(long itemId) {
        return "book_item:" + itemId;
    }

    public static String managerSelectItem(long itemId) {
        return "manager_select_item:" + itemId;
    }

    public static String showBooking(long bookingId) {
        return "show_booking:" + bookingId;
    }

    public static String callBooking(long bookingId) {
        return "call_booking:" + bookingId;
    }

    /** {@code <action>_<bookingId>} for the manager actions on a booking. */
    public static String bookingAction(CallbackAction action, long bookingId) {
        String prefix = switch (action) {
            case CONFIRM -> "confirm_";
            case REJECT -> "reject_";
            case RESCHEDULE -> "reschedule_";
            case REOPEN -> "reopen_";
            case COMPLETE -> "complete_";
            case CHANGE_ITEM -> "change_item_";
            default -> throw new IllegalArgumentException("Not a booking action: " + action);
        };
        return prefix + bookingId;
    }

    public static String changeTo(long bookingId, long itemId) {
        return CHANGE_TO_PREFIX + bookingId + "_" + itemId;
    }
}
