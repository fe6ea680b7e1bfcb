package com.example.rental.service.handler;

import com.example.rental.dto.ConversationState;
import com.example.rental.dto.IncomingUpdate;
import com.example.rental.dto.ScratchData;
import com.example.rental.model.ConversationStep;
import com.example.rental.model.Item;
import com.example.rental.model.ScratchKeys;
import com.example.rental.service.BookingService;
import com.example.rental.service.ChatSender;
import com.example.rental.service.ConversationStateService;
import com.example.rental.service.ItemService;
import com.example.rental.service.callback.CallbackData;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.util.DateInputParser;
import com.example.rental.service.util.KeyboardUtil;
import lombok.RequiredArgsConstructor;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only availability views: 30 days ahead or one chosen date.
 */
@Component
@RequiredArgsConstructor
public class ScheduleHandler {

    static final int LISTING_DAYS = 30;
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("dd.MM");
    private static final Locale RU = new Locale("ru");

    private final ChatSender sender;
    private final ConversationStateService stateService;
    private final BookingService bookingService;
    private final ItemService itemService;
    private final ItemPageRenderer itemPages;
    private final UserBookingHandler userBooking;
    private final Clock clock;

    public void start(IncomingUpdate u) {
        stateService.set(u.userId(), ConversationStep.SCHEDULE_SELECT_ITEM, new ScratchData().put(ScratchKeys.PAGE, 0));
        showPage(u, 0, null);
    }

    public void showPage(IncomingUpdate u, int page, Integer messageId) {
        itemPages.render(u.chatId(), messageId, "📅 Выберите аппарат для просмотра расписания:", page,
                CallbackData::scheduleSelectItem, CallbackData.SCHEDULE_ITEMS_PAGE_PREFIX,
                CallbackData.BACK_TO_MAIN_FROM_SCHEDULE_DATA);
    }

    public void onItemSelected(IncomingUpdate u, long itemId) {
        Item item = activeItem(itemId);
        stateService.set(u.userId(), ConversationStep.VIEW_SCHEDULE, new ScratchData().put(ScratchKeys.ITEM_ID, itemId));
        showOptions(u.chatId(), item);
    }

    /** Reply keyboard choice while looking at an item's schedule. */
    public void onMenuChoice(IncomingUpdate u, ConversationState state) {
        Long itemId = state.data().getLong(ScratchKeys.ITEM_ID);
        Item item = activeItem(itemId);
        switch (u.trimmedText()) {
            case Labels.SCHEDULE_30_DAYS -> showListing(u.chatId(), item);
            case Labels.SCHEDULE_PICK_DATE -> {
                stateService.set(u.userId(), ConversationStep.WAITING_SPECIFIC_DATE, state.data());
                sender.send(u.chatId(), "🗓 Введите дату в формате ДД.ММ.ГГГГ:",
                        KeyboardUtil.reply(List.of(List.of(Labels.BACK, Labels.CANCEL))));
            }
            case Labels.SCHEDULE_BACK_TO_ITEMS -> start(u);
            case Labels.SCHEDULE_BOOK -> userBooking.onItemSelected(u, itemId);
            default -> showOptions(u.chatId(), item);
        }
    }

    public void onSpecificDate(IncomingUpdate u, ConversationState state) {
        LocalDate date = DateInputParser.parse(u.trimmedText()).orElse(null);
        if (date == null) {
            sender.sendText(u.chatId(), "❌ Неверный формат даты. Используйте ДД.ММ.ГГГГ");
            return;
        }
        Item item = activeItem(state.data().getLong(ScratchKeys.ITEM_ID));
        long booked = bookingService.bookedCount(item.getId(), date);
        String verdict = booked < item.getTotalQuantity() ? "✅ Есть свободные" : "❌ Все занято";
        stateService.set(u.userId(), ConversationStep.VIEW_SCHEDULE, state.data());
        sender.send(u.chatId(), """
                📅 %s, %s
                Забронировано: %d/%d
                %s""".formatted(item.getName(), DateInputParser.format(date), booked, item.getTotalQuantity(), verdict),
                optionsKeyboard());
    }

    public void prompt(IncomingUpdate u, ConversationState state) {
        if (state.step() == ConversationStep.SCHEDULE_SELECT_ITEM) {
            showPage(u, state.data().getInt(ScratchKeys.PAGE, 0), null);
        } else {
            showOptions(u.chatId(), activeItem(state.data().getLong(ScratchKeys.ITEM_ID)));
        }
    }

    private void showListing(long chatId, Item item) {
        LocalDate today = LocalDate.now(clock);
        Map<LocalDate, Long> counts = bookingService.availabilityForPeriod(item.getId(), today, LISTING_DAYS);
        StringBuilder sb = new StringBuilder("📅 %s на %d дней:\n\n".formatted(item.getName(), LISTING_DAYS));
        counts.forEach((date, booked) -> {
            String day = date.format(DAY) + " (" + date.getDayOfWeek().getDisplayName(TextStyle.SHORT, RU) + ")";
            if (booked >= item.getTotalQuantity()) {
                sb.append(day).append(": ❌ занято\n");
            } else {
                sb.append(day).append(": ✅ ").append(booked).append('/').append(item.getTotalQuantity()).append('\n');
            }
        });
        sender.send(chatId, sb.toString().trim(),
                KeyboardUtil.single(Labels.SCHEDULE_BOOK, CallbackData.bookItem(item.getId())));
    }

    private void showOptions(long chatId, Item item) {
        sender.send(chatId, "Аппарат: %s (всего %d шт.)\nЧто показать?".formatted(item.getName(), item.getTotalQuantity()),
                optionsKeyboard());
    }

    private static ReplyKeyboardMarkup optionsKeyboard() {
        return KeyboardUtil.reply(List.of(
                List.of(Labels.SCHEDULE_30_DAYS, Labels.SCHEDULE_PICK_DATE),
                List.of(Labels.SCHEDULE_BOOK, Labels.SCHEDULE_BACK_TO_ITEMS),
                List.of(Labels.MAIN_MENU)));
    }

    private Item activeItem(Long itemId) {
        return itemService.findById(itemId)
                .filter(Item::isActive)
                .orElseThrow(() -> new NotFoundException("Item", itemId));
    }
}
