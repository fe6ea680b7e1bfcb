package com.example.rental.service.handler;

import com.example.rental.dto.Actor;
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
import com.example.rental.service.callback.CallbackData;
import com.example.rental.service.exception.BookingException;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.util.DateInputParser;
import com.example.rental.service.util.ErrorMessages;
import com.example.rental.service.util.InputSanitizer;
import com.example.rental.service.util.KeyboardUtil;
import com.example.rental.service.util.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.example.rental.model.ScratchKeys.*;
import static com.example.rental.service.util.KeyboardUtil.btn;

/**
 * Manager creates confirmed bookings for a client over one date or a range of dates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManagerBookingHandler {

    private static final List<List<String>> NAV = List.of(List.of(Labels.BACK, Labels.CANCEL));

    private final ChatSender sender;
    private final ConversationStateService stateService;
    private final BookingService bookingService;
    private final ItemService itemService;
    private final ItemPageRenderer itemPages;
    private final MainMenuHandler mainMenu;

    public void start(IncomingUpdate u) {
        stateService.set(u.userId(), ConversationStep.MANAGER_WAITING_CLIENT_NAME,
                new ScratchData().put(IS_MANAGER_BOOKING, true));
        promptClientName(u.chatId());
    }

    public void onClientName(IncomingUpdate u, ConversationState state) {
        String name = InputSanitizer.sanitize(u.trimmedText());
        if (!InputSanitizer.isValidName(name)) {
            sender.sendText(u.chatId(), "❌ Имя клиента должно содержать от 2 до 150 символов.");
            return;
        }
        stateService.advance(state, ConversationStep.MANAGER_WAITING_CLIENT_PHONE, CLIENT_NAME, name);
        promptClientPhone(u.chatId());
    }

    public void onClientPhone(IncomingUpdate u, ConversationState state) {
        String phone = PhoneNumbers.normalize(u.contactPhone() != null ? u.contactPhone() : u.trimmedText());
        if (phone.isEmpty()) {
            sender.sendText(u.chatId(), "❌ Неверный формат номера. Пример: +7 999 123-45-67");
            return;
        }
        stateService.advance(state, ConversationStep.MANAGER_WAITING_ITEM_SELECTION, CLIENT_PHONE, phone);
        showItems(u, 0, null);
    }

    public void showItems(IncomingUpdate u, int page, Integer messageId) {
        itemPages.render(u.chatId(), messageId, "Выберите аппарат для клиента:", page,
                CallbackData::managerSelectItem, CallbackData.MANAGER_ITEMS_PAGE_PREFIX, CallbackData.BACK_TO_MAIN_DATA);
    }

    public void onItemSelected(IncomingUpdate u, ConversationState state, long itemId) {
        if (!state.step().isManagerFlow() || !state.data().has(CLIENT_PHONE)) {
            mainMenu.reset(u.userId(), u.chatId(), "Сессия устарела. Начните заново.");
            return;
        }
        Item item = itemService.findById(itemId)
                .filter(Item::isActive)
                .orElseThrow(() -> new NotFoundException("Item", itemId));
        stateService.advance(state, ConversationStep.MANAGER_WAITING_DATE_TYPE, ITEM_ID, item.getId());
        promptDateType(u.chatId(), item);
    }

    public void onDateType(IncomingUpdate u, ConversationState state, boolean range) {
        if (!state.data().has(ITEM_ID) || !state.step().isManagerFlow()) {
            mainMenu.reset(u.userId(), u.chatId(), "Сессия устарела. Начните заново.");
            return;
        }
        if (range) {
            stateService.advance(state, ConversationStep.MANAGER_WAITING_START_DATE, DATE_TYPE, DATE_TYPE_RANGE);
            sender.send(u.chatId(), "📅 Введите дату начала (ДД.ММ.ГГГГ):", KeyboardUtil.reply(NAV));
        } else {
            stateService.advance(state, ConversationStep.MANAGER_WAITING_SINGLE_DATE, DATE_TYPE, DATE_TYPE_SINGLE);
            sender.send(u.chatId(), "📅 Введите дату (ДД.ММ.ГГГГ):", KeyboardUtil.reply(NAV));
        }
    }

    public void onSingleDate(IncomingUpdate u, ConversationState state) {
        LocalDate date = parseDate(u);
        if (date == null) return;
        bookingService.validateDate(date);
        stateService.advance(state, ConversationStep.MANAGER_WAITING_COMMENT, DATES, List.of(date));
        promptComment(u.chatId());
    }

    public void onStartDate(IncomingUpdate u, ConversationState state) {
        LocalDate start = parseDate(u);
        if (start == null) return;
        bookingService.validateDate(start);
        stateService.advance(state, ConversationStep.MANAGER_WAITING_END_DATE, START_DATE, start);
        sender.send(u.chatId(), "📅 Введите дату окончания (ДД.ММ.ГГГГ):", KeyboardUtil.reply(NAV));
    }

    public void onEndDate(IncomingUpdate u, ConversationState state) {
        LocalDate end = parseDate(u);
        if (end == null) return;
        LocalDate start = state.data().getDate(START_DATE);
        if (end.isBefore(start)) {
            sender.sendText(u.chatId(), "❌ Дата окончания не может быть раньше даты начала.");
            return;
        }
        if (!DateInputParser.isValidRange(start, end)) {
            sender.sendText(u.chatId(), "❌ Период не может быть длиннее %d дней."
                    .formatted(DateInputParser.MAX_RANGE_DAYS + 1));
            return;
        }
        bookingService.validateDate(end);
        stateService.advance(state, ConversationStep.MANAGER_WAITING_COMMENT, DATES,
                DateInputParser.expand(start, end));
        promptComment(u.chatId());
    }

    public void onComment(IncomingUpdate u, ConversationState state) {
        String text = u.trimmedText();
        String comment = Labels.SKIP.equalsIgnoreCase(text) || "-".equals(text) ? "" : InputSanitizer.sanitize(text);
        ConversationState next = stateService.advance(state, ConversationStep.MANAGER_CONFIRM_BOOKING, COMMENT, comment);
        showSummary(u.chatId(), next.data());
    }

    public void onConfirm(IncomingUpdate u, ConversationState state) {
        if (!Labels.MANAGER_CONFIRM.equals(u.trimmedText())) {
            showSummary(u.chatId(), state.data());
            return;
        }
        ScratchData data = state.data();
        Item item = itemService.findById(data.getLong(ITEM_ID))
                .orElseThrow(() -> new NotFoundException("Item", data.getLong(ITEM_ID)));
        Actor manager = new Actor(u.userId(), managerName(u));

        List<Booking> created = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (LocalDate date : data.getDates(DATES)) {
            Booking draft = new Booking();
            draft.setUserId(u.userId());
            draft.setUserName(data.getString(CLIENT_NAME));
            draft.setUserNickname(u.username());
            draft.setPhone(data.getString(CLIENT_PHONE));
            draft.setItemId(item.getId());
            draft.setItemName(item.getName());
            draft.setDate(date);
            draft.setComment(data.getString(COMMENT));
            try {
                created.add(bookingService.createManagerBooking(draft, manager));
            } catch (BookingException e) {
                log.info("Manager booking for {} on {} rejected: {}", item.getId(), date, e.getMessage());
                failed.add(DateInputParser.format(date) + ": " + ErrorMessages.forException(e));
            }
        }

        StringBuilder report = new StringBuilder();
        if (!created.isEmpty()) {
            report.append("✅ Создано заявок: ").append(created.size()).append('\n');
            report.append(created.stream()
                    .map(b -> "#" + b.getId() + " • " + DateInputParser.format(b.getDate()))
                    .collect(Collectors.joining("\n")));
        }
        if (!failed.isEmpty()) {
            if (!report.isEmpty()) report.append("\n\n");
            report.append("❌ Не удалось создать:\n").append(String.join("\n", failed));
        }
        mainMenu.reset(u.userId(), u.chatId(), report.toString());
    }

    public void prompt(IncomingUpdate u, ConversationState state) {
        switch (state.step()) {
            case MANAGER_WAITING_CLIENT_NAME -> promptClientName(u.chatId());
            case MANAGER_WAITING_CLIENT_PHONE -> promptClientPhone(u.chatId());
            case MANAGER_WAITING_ITEM_SELECTION -> showItems(u, 0, null);
            case MANAGER_WAITING_DATE_TYPE -> promptDateType(u.chatId(),
                    itemService.findById(state.data().getLong(ITEM_ID)).orElse(null));
            case MANAGER_WAITING_SINGLE_DATE -> sender.send(u.chatId(), "📅 Введите дату (ДД.ММ.ГГГГ):", KeyboardUtil.reply(NAV));
            case MANAGER_WAITING_START_DATE -> sender.send(u.chatId(), "📅 Введите дату начала (ДД.ММ.ГГГГ):", KeyboardUtil.reply(NAV));
            case MANAGER_WAITING_END_DATE -> sender.send(u.chatId(), "📅 Введите дату окончания (ДД.ММ.ГГГГ):", KeyboardUtil.reply(NAV));
            case MANAGER_WAITING_COMMENT -> promptComment(u.chatId());
            case MANAGER_CONFIRM_BOOKING -> showSummary(u.chatId(), state.data());
            default -> mainMenu.show(u.userId(), u.chatId(), null);
        }
    }

    private LocalDate parseDate(IncomingUpdate u) {
        LocalDate date = DateInputParser.parse(u.trimmedText()).orElse(null);
        if (date == null) {
            sender.sendText(u.chatId(), "❌ Неверный формат даты. Используйте ДД.ММ.ГГГГ");
        }
        return date;
    }

    private void showSummary(long chatId, ScratchData data) {
        String itemName = itemService.findById(data.getLong(ITEM_ID)).map(Item::getName).orElse("?");
        List<LocalDate> dates = data.getDates(DATES);
        String period = dates.size() == 1
                ? DateInputParser.format(dates.get(0))
                : DateInputParser.format(dates.get(0)) + " - " + DateInputParser.format(dates.get(dates.size() - 1))
                  + " (" + dates.size() + " дн.)";
        String comment = data.getString(COMMENT);
        sender.send(chatId, """
                📋 Проверьте заявку:
                Клиент: %s
                Телефон: %s
                Аппарат: %s
                Даты: %s
                Комментарий: %s""".formatted(data.getString(CLIENT_NAME),
                        PhoneNumbers.format(data.getString(CLIENT_PHONE)), itemName, period,
                        comment == null || comment.isBlank() ? "нет" : comment),
                KeyboardUtil.reply(List.of(List.of(Labels.MANAGER_CONFIRM), List.of(Labels.BACK, Labels.CANCEL))));
    }

    private void promptClientName(long chatId) {
        sender.send(chatId, "👤 Введите имя клиента:", KeyboardUtil.reply(List.of(List.of(Labels.CANCEL))));
    }

    private void promptClientPhone(long chatId) {
        sender.send(chatId, "📱 Введите телефон клиента:", KeyboardUtil.reply(NAV));
    }

    private void promptDateType(long chatId, Item item) {
        String header = item != null ? "Аппарат: " + item.getName() + "\n\n" : "";
        sender.send(chatId, header + "Бронирование на одну дату или на период?", KeyboardUtil.rows(List.of(
                List.of(btn("📅 Одна дата", CallbackData.MANAGER_SINGLE_DATE_DATA),
                        btn("🗓 Период", CallbackData.MANAGER_DATE_RANGE_DATA)))));
    }

    private void promptComment(long chatId) {
        sender.send(chatId, "💬 Введите комментарий или нажмите «Пропустить»:",
                KeyboardUtil.reply(List.of(List.of(Labels.SKIP), List.of(Labels.BACK, Labels.CANCEL))));
    }

    private static String managerName(IncomingUpdate u) {
        String name = ((u.firstName() == null ? "" : u.firstName()) + " " + (u.lastName() == null ? "" : u.lastName())).trim();
        return name.isEmpty() ? String.valueOf(u.userId()) : name;
    }
}
