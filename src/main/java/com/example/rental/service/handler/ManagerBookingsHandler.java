package com.example.rental.service.handler;

import com.example.rental.config.BotConfig;
import com.example.rental.dto.Actor;
import com.example.rental.dto.ConversationState;
import com.example.rental.dto.IncomingUpdate;
import com.example.rental.model.Booking;
import com.example.rental.model.Item;
import com.example.rental.model.ScratchKeys;
import com.example.rental.service.BookingService;
import com.example.rental.service.ChatSender;
import com.example.rental.service.ConversationStateService;
import com.example.rental.service.ItemService;
import com.example.rental.service.callback.CallbackAction;
import com.example.rental.service.callback.CallbackData;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.util.KeyboardUtil;
import com.example.rental.service.util.Pagination;
import com.example.rental.service.util.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.example.rental.service.util.KeyboardUtil.btn;

/**
 * Manager view over existing bookings: paged list, booking card and the status actions.
 * The version shown on the card is remembered in the manager's scratch data, so acting on a
 * stale card fails with a conflict instead of overwriting someone else's change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManagerBookingsHandler {

    private final ChatSender sender;
    private final BookingService bookingService;
    private final ItemService itemService;
    private final ConversationStateService stateService;
    private final BotConfig config;
    private final Clock clock;

    public void showList(IncomingUpdate u, int page, Integer messageId) {
        LocalDate today = LocalDate.now(clock);
        List<Booking> bookings = bookingService.bookingsInRange(today.minusDays(7), today.plusMonths(2));
        if (bookings.isEmpty()) {
            sender.sendText(u.chatId(), "📋 Заявок за период нет.");
            return;
        }
        int size = config.getBookingsPaginationSize() > 0 ? config.getBookingsPaginationSize() : 5;
        Pagination<Booking> view = Pagination.of(bookings, page, size);
        var keyboard = view.keyboard(b -> btn(BookingCards.shortLine(b), CallbackData.showBooking(b.getId())),
                CallbackData.MANAGER_BOOKINGS_PAGE_PREFIX, Labels.MAIN_MENU, CallbackData.BACK_TO_MAIN_DATA);
        String text = "📋 Все заявки (%d)\n%s".formatted(view.totalItems(), view.caption());
        if (messageId != null) {
            sender.editMessage(u.chatId(), messageId, text, keyboard);
        } else {
            sender.send(u.chatId(), text, keyboard);
        }
    }

    public void showBooking(IncomingUpdate u, long bookingId) {
        Booking booking = bookingService.findBooking(bookingId)
                .orElseThrow(() -> new NotFoundException("Booking", bookingId));
        rememberVersion(u.userId(), booking);
        if (u.isCallback() && u.messageId() != null) {
            sender.editMessage(u.chatId(), u.messageId(), BookingCards.text(booking), BookingCards.actions(booking));
        } else {
            sender.send(u.chatId(), BookingCards.text(booking), BookingCards.actions(booking));
        }
    }

    public void onAction(IncomingUpdate u, CallbackAction action, long bookingId) {
        long version = versionFor(u.userId(), bookingId);
        Actor manager = new Actor(u.userId(), u.username() != null ? "@" + u.username() : String.valueOf(u.userId()));
        Booking updated = switch (action) {
            case CONFIRM -> bookingService.confirm(bookingId, version, manager);
            case REJECT -> bookingService.reject(bookingId, version, manager);
            case COMPLETE -> bookingService.complete(bookingId, version, manager);
            case REOPEN -> bookingService.reopen(bookingId, version, manager);
            case RESCHEDULE -> bookingService.reschedule(bookingId, version, manager);
            default -> throw new IllegalArgumentException("Unsupported booking action " + action);
        };
        rememberVersion(u.userId(), updated);
        sender.answerCallback(u.callbackId(), "Статус: " + updated.getStatus().label());
        refreshCard(u, updated);
    }

    public void showChangeItem(IncomingUpdate u, long bookingId) {
        Booking booking = bookingService.findBooking(bookingId)
                .orElseThrow(() -> new NotFoundException("Booking", bookingId));
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (Item item : itemService.listActive()) {
            if (!item.getId().equals(booking.getItemId())) {
                rows.add(List.of(btn(item.getName(), CallbackData.changeTo(bookingId, item.getId()))));
            }
        }
        if (rows.isEmpty()) {
            sender.sendText(u.chatId(), "Нет других аппаратов для замены.");
            return;
        }
        rows.add(List.of(btn(Labels.BACK, CallbackData.showBooking(bookingId))));
        sender.send(u.chatId(), "🔄 Выберите новый аппарат для заявки #" + bookingId + ":", KeyboardUtil.rows(rows));
    }

    public void onChangeTo(IncomingUpdate u, long bookingId, long itemId) {
        long version = versionFor(u.userId(), bookingId);
        Actor manager = new Actor(u.userId(), u.username() != null ? "@" + u.username() : String.valueOf(u.userId()));
        Booking updated = bookingService.changeItem(bookingId, version, itemId, manager);
        rememberVersion(u.userId(), updated);
        sender.answerCallback(u.callbackId(), "Аппарат изменен");
        refreshCard(u, updated);
    }

    public void onCall(IncomingUpdate u, long bookingId) {
        Booking booking = bookingService.findBooking(bookingId)
                .orElseThrow(() -> new NotFoundException("Booking", bookingId));
        if (booking.getPhone() == null || booking.getPhone().isBlank()) {
            sender.sendText(u.chatId(), "У заявки #" + bookingId + " нет телефона.");
            return;
        }
        sender.sendText(u.chatId(), "📞 %s\n%s".formatted(booking.getUserName(), PhoneNumbers.format(booking.getPhone())));
    }

    private void refreshCard(IncomingUpdate u, Booking booking) {
        if (u.messageId() != null) {
            sender.editMessage(u.chatId(), u.messageId(), BookingCards.text(booking), BookingCards.actions(booking));
        } else {
            sender.send(u.chatId(), BookingCards.text(booking), BookingCards.actions(booking));
        }
    }

    private long versionFor(long managerId, long bookingId) {
        ConversationState state = stateService.get(managerId);
        Long seen = state.data().getLong(ScratchKeys.version(bookingId));
        if (seen != null) {
            return seen;
        }
        return bookingService.findBooking(bookingId)
                .map(Booking::getVersion)
                .orElseThrow(() -> new NotFoundException("Booking", bookingId));
    }

    private void rememberVersion(long managerId, Booking booking) {
        ConversationState state = stateService.get(managerId);
        stateService.advance(state, state.step(), ScratchKeys.version(booking.getId()), booking.getVersion());
    }
}
