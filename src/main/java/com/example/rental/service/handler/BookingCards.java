package com.example.rental.service.handler;

import com.example.rental.model.Booking;
import com.example.rental.model.BookingStatus;
import com.example.rental.service.callback.CallbackAction;
import com.example.rental.service.callback.CallbackData;
import com.example.rental.service.util.DateInputParser;
import com.example.rental.service.util.KeyboardUtil;
import com.example.rental.service.util.PhoneNumbers;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import static com.example.rental.service.util.KeyboardUtil.btn;

/** Text and action buttons of a booking as shown to managers. */
public final class BookingCards {
    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("dd.MM");
    private BookingCards() {}

    public static String text(Booking b) {
        String nickname = b.getUserNickname() != null && !b.getUserNickname().isBlank()
                ? " (@" + b.getUserNickname() + ")" : "";
        String comment = b.getComment() != null && !b.getComment().isBlank()
                ? "\n💬 " + b.getComment() : "";
        return """
                📋 Заявка #%d
                Аппарат: %s
                Дата: %s
                Клиент: %s%s
                Телефон: %s
                Статус: %s%s""".formatted(b.getId(), b.getItemName(), DateInputParser.format(b.getDate()),
                b.getUserName(), nickname, PhoneNumbers.format(b.getPhone()), b.getStatus().label(), comment);
    }

    public static String shortLine(Booking b) {
        return "#%d %s %s %s".formatted(b.getId(), b.getDate().format(SHORT_DATE),
                b.getItemName(), statusIcon(b.getStatus()));
    }

    public static InlineKeyboardMarkup actions(Booking b) {
        long id = b.getId();
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        switch (b.getStatus()) {
            case PENDING, CHANGED, RESCHEDULED -> {
                rows.add(List.of(btn("✅ Подтвердить", CallbackData.bookingAction(CallbackAction.CONFIRM, id)),
                        btn("❌ Отклонить", CallbackData.bookingAction(CallbackAction.REJECT, id))));
                if (b.getStatus() == BookingStatus.PENDING) {
                    rows.add(List.of(btn("🔄 Сменить аппарат", CallbackData.bookingAction(CallbackAction.CHANGE_ITEM, id)),
                            btn("📅 Перенести", CallbackData.bookingAction(CallbackAction.RESCHEDULE, id))));
                }
            }
            case CONFIRMED -> {
                rows.add(List.of(btn("🏁 Завершить", CallbackData.bookingAction(CallbackAction.COMPLETE, id)),
                        btn("↩️ Вернуть в ожидание", CallbackData.bookingAction(CallbackAction.REOPEN, id))));
                rows.add(List.of(btn("🔄 Сменить аппарат", CallbackData.bookingAction(CallbackAction.CHANGE_ITEM, id)),
                        btn("📅 Перенести", CallbackData.bookingAction(CallbackAction.RESCHEDULE, id))));
            }
            default -> {
            }
        }
        if (b.getStatus().isActive() && b.getPhone() != null && !b.getPhone().isBlank()) {
            rows.add(List.of(btn("📞 Позвонить", CallbackData.callBooking(id))));
        }
        rows.add(List.of(btn("📋 Все заявки", CallbackData.MANAGER_BOOKINGS_PAGE_PREFIX + 0)));
        return KeyboardUtil.rows(rows);
    }

    static String statusIcon(BookingStatus status) {
        return switch (status) {
            case PENDING -> "⏳";
            case CONFIRMED -> "✅";
            case CHANGED -> "🔄";
            case RESCHEDULED -> "📅";
            case CANCELED -> "❌";
            case COMPLETED -> "🏁";
        };
    }
}
