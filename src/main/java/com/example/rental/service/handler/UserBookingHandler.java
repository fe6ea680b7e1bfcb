package com.example.rental.service.handler;

import com.example.rental.dto.ConversationState;
import com.example.rental.dto.IncomingUpdate;
import com.example.rental.dto.ScratchData;
import com.example.rental.model.Booking;
import com.example.rental.model.ConversationStep;
import com.example.rental.model.Item;
import com.example.rental.service.BookingService;
import com.example.rental.service.ChatSender;
import com.example.rental.service.ConversationStateService;
import com.example.rental.service.ItemService;
import com.example.rental.service.UserService;
import com.example.rental.service.callback.CallbackData;
import com.example.rental.service.exception.NotAvailableException;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.util.DateInputParser;
import com.example.rental.service.util.InputSanitizer;
import com.example.rental.service.util.KeyboardUtil;
import com.example.rental.service.util.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

import static com.example.rental.model.ScratchKeys.*;

/**
 * End-user booking capture: item, date, name, phone, then the booking is filed as pending.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserBookingHandler {

    private final ChatSender sender;
    private final ConversationStateService stateService;
    private final BookingService bookingService;
    private final ItemService itemService;
    private final UserService userService;
    private final MainMenuHandler mainMenu;
    private final ItemPageRenderer itemPages;

    public void start(IncomingUpdate u) {
        stateService.set(u.userId(), ConversationStep.SELECT_ITEM, new ScratchData().put(PAGE, 0));
        itemPages.render(u.chatId(), null, "Выберите аппарат:", 0,
                CallbackData::selectItem, CallbackData.ITEMS_PAGE_PREFIX, CallbackData.BACK_TO_MAIN_DATA);
    }

    public void showPage(IncomingUpdate u, int page) {
        ConversationState state = stateService.get(u.userId());
        stateService.set(u.userId(), ConversationStep.SELECT_ITEM, state.data().copy().put(PAGE, page));
        itemPages.render(u.chatId(), u.messageId(), "Выберите аппарат:", page,
                CallbackData::selectItem, CallbackData.ITEMS_PAGE_PREFIX, CallbackData.BACK_TO_MAIN_DATA);
    }

    public void onItemSelected(IncomingUpdate u, long itemId) {
        Item item = itemService.findById(itemId)
                .filter(Item::isActive)
                .orElseThrow(() -> new NotFoundException("Item", itemId));
        stateService.set(u.userId(), ConversationStep.WAITING_DATE, new ScratchData().put(ITEM_ID, item.getId()));
        promptDate(u.chatId(), item);
    }

    public void onDate(IncomingUpdate u, ConversationState state) {
        LocalDate date = DateInputParser.parse(u.trimmedText()).orElse(null);
        if (date == null) {
            sender.sendText(u.chatId(), "❌ Неверный формат даты. Введите дату в формате ДД.ММ.ГГГГ, например 05.06.2025");
            return;
        }
        Long itemId = state.data().getLong(ITEM_ID);
        bookingService.validateDate(date);
        if (!bookingService.checkAvailability(itemId, date)) {
            throw new NotAvailableException(itemId, date);
        }
        stateService.advance(state, ConversationStep.ENTER_NAME, DATE, date);
        promptName(u.chatId());
    }

    public void onName(IncomingUpdate u, ConversationState state) {
        String name = InputSanitizer.sanitize(u.trimmedText());
        if (!InputSanitizer.isValidName(name)) {
            sender.sendText(u.chatId(), "❌ Имя должно содержать от 2 до 150 символов. Попробуйте еще раз:");
            return;
        }
        stateService.advance(state, ConversationStep.PHONE_NUMBER, USER_NAME, name);
        promptPhone(u.chatId());
    }

    public void onPhone(IncomingUpdate u, ConversationState state) {
        String raw = u.contactPhone() != null ? u.contactPhone() : u.trimmedText();
        String phone = PhoneNumbers.normalize(raw);
        if (phone.isEmpty()) {
            sender.sendText(u.chatId(), "❌ Неверный формат номера. Отправьте контакт или введите номер, например +7 999 123-45-67");
            return;
        }
        ConversationState confirming = stateService.advance(state, ConversationStep.CONFIRMATION, PHONE, phone);
        finish(u, confirming);
    }

    private void finish(IncomingUpdate u, ConversationState state) {
        ScratchData data = state.data();
        Long itemId = data.getLong(ITEM_ID);
        Item item = itemService.findById(itemId).orElseThrow(() -> new NotFoundException("Item", itemId));

        Booking draft = new Booking();
        draft.setUserId(u.userId());
        draft.setUserName(data.getString(USER_NAME));
        draft.setUserNickname(u.username());
        draft.setPhone(data.getString(PHONE));
        draft.setItemId(item.getId());
        draft.setItemName(item.getName());
        draft.setDate(data.getDate(DATE));

        sender.sendText(u.chatId(), """
                📋 Ваша заявка:
                Аппарат: %s
                Дата: %s
                Имя: %s
                Телефон: %s""".formatted(item.getName(), DateInputParser.format(draft.getDate()),
                draft.getUserName(), PhoneNumbers.format(draft.getPhone())));

        Booking created = bookingService.createBooking(draft);
        try {
            userService.updatePhone(u.userId(), created.getPhone());
        } catch (Exception e) {
            log.warn("Failed to store phone of user {}: {}", u.userId(), e.getMessage());
        }
        mainMenu.reset(u.userId(), u.chatId(),
                "✅ Заявка #%d создана и ожидает подтверждения менеджера.".formatted(created.getId()));
    }

    /** Repeats the question of the step the user went back to. */
    public void prompt(IncomingUpdate u, ConversationState state) {
        switch (state.step()) {
            case SELECT_ITEM -> showPage(u, state.data().getInt(PAGE, 0));
            case WAITING_DATE -> promptDate(u.chatId(), itemService.findById(state.data().getLong(ITEM_ID)).orElse(null));
            case ENTER_NAME -> promptName(u.chatId());
            case PHONE_NUMBER, CONFIRMATION -> promptPhone(u.chatId());
            default -> mainMenu.show(u.userId(), u.chatId(), null);
        }
    }

    public void showMyBookings(IncomingUpdate u) {
        List<Booking> bookings = bookingService.userBookings(u.userId());
        if (bookings.isEmpty()) {
            sender.sendText(u.chatId(), "📊 У вас пока нет заявок.");
            return;
        }
        StringBuilder sb = new StringBuilder("📊 Ваши заявки:\n\n");
        for (Booking b : bookings) {
            sb.append("#%d • %s • %s\n%s\n\n".formatted(b.getId(), DateInputParser.format(b.getDate()),
                    b.getItemName(), b.getStatus().label()));
        }
        sender.sendText(u.chatId(), sb.toString().trim());
    }

    public void showItems(IncomingUpdate u) {
        List<Item> items = itemService.listActive();
        if (items.isEmpty()) {
            sender.sendText(u.chatId(), "😔 Сейчас нет доступных аппаратов.");
            return;
        }
        StringBuilder sb = new StringBuilder("💼 Наш ассортимент:\n\n");
        for (Item item : items) {
            sb.append("• ").append(item.getName());
            if (item.getTotalQuantity() > 1) {
                sb.append(" (").append(item.getTotalQuantity()).append(" шт.)");
            }
            if (item.getDescription() != null && !item.getDescription().isBlank()) {
                sb.append(": ").append(item.getDescription());
            }
            sb.append('\n');
        }
        sender.sendText(u.chatId(), sb.toString().trim());
    }

    private void promptDate(long chatId, Item item) {
        String header = item != null ? "Вы выбрали: " + item.getName() + "\n\n" : "";
        sender.send(chatId, header + "📅 Введите дату бронирования в формате ДД.ММ.ГГГГ:",
                KeyboardUtil.reply(List.of(List.of(Labels.BACK, Labels.CANCEL))));
    }

    private void promptName(long chatId) {
        sender.send(chatId, "👤 Введите ваше имя:",
                KeyboardUtil.reply(List.of(List.of(Labels.BACK, Labels.CANCEL))));
    }

    private void promptPhone(long chatId) {
        sender.send(chatId, "📱 Отправьте номер телефона кнопкой ниже или введите его вручную:",
                KeyboardUtil.contactRequest(Labels.SEND_CONTACT, List.of(List.of(Labels.BACK, Labels.CANCEL))));
    }
}
