package com.example.rental.service;

import com.example.rental.dto.ConversationState;
import com.example.rental.dto.IncomingUpdate;
import com.example.rental.dto.RateLimitResult;
import com.example.rental.model.ConversationStep;
import com.example.rental.service.callback.Callback;
import com.example.rental.service.callback.CallbackData;
import com.example.rental.service.exception.BookingException;
import com.example.rental.service.exception.StorageException;
import com.example.rental.service.exception.TransportException;
import com.example.rental.service.handler.Labels;
import com.example.rental.service.handler.MainMenuHandler;
import com.example.rental.service.handler.ManagerBookingHandler;
import com.example.rental.service.handler.ManagerBookingsHandler;
import com.example.rental.service.handler.ManagerItemHandler;
import com.example.rental.service.handler.ManagerStatsHandler;
import com.example.rental.service.handler.ScheduleHandler;
import com.example.rental.service.handler.UserBookingHandler;
import com.example.rental.service.util.ErrorMessages;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for every chat update: access checks, rate limiting, then routing by button,
 * command or conversation step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatOrchestrator {

    static final String RATE_LIMITED = "⏳ Слишком много запросов. Подождите минуту и попробуйте снова.";
    static final String STALE_SESSION = "Сессия устарела. Начните заново.";
    static final String MANAGERS_ONLY = "⛔ Команда доступна только менеджерам.";

    private static final Pattern MANAGER_BOOKING = Pattern.compile("^/manager_booking_(\\d+)$");

    private final UserService userService;
    private final ConversationStateService stateService;
    private final BookingService bookingService;
    private final ChatSender sender;
    private final BotMetrics metrics;
    private final MainMenuHandler mainMenu;
    private final UserBookingHandler userBooking;
    private final ScheduleHandler schedule;
    private final ManagerBookingHandler managerBooking;
    private final ManagerBookingsHandler managerBookings;
    private final ManagerItemHandler managerItems;
    private final ManagerStatsHandler managerStats;

    public void handle(IncomingUpdate u) {
        if (userService.isBlacklisted(u.userId())) {
            log.debug("Ignoring update from blacklisted user {}", u.userId());
            metrics.updateDropped("blacklisted");
            return;
        }
        boolean manager = userService.isManager(u.userId());
        if (!manager) {
            RateLimitResult limit = stateService.checkRateLimit(u.userId());
            if (!limit.allowed()) {
                metrics.updateDropped("rate_limited");
                if (limit.firstRejection()) {
                    sender.sendText(u.chatId(), RATE_LIMITED);
                }
                return;
            }
        }
        registerActivity(u);

        try {
            if (u.isCallback()) {
                onCallback(u, manager);
            } else {
                onMessage(u, manager);
            }
        } catch (BookingException e) {
            log.info("User {} request rejected: {}", u.userId(), e.getMessage());
            String text = ErrorMessages.forException(e);
            if (ErrorMessages.resetsFlow(e)) {
                mainMenu.reset(u.userId(), u.chatId(), text);
            } else {
                sender.sendText(u.chatId(), text);
            }
        } catch (StorageException | TransportException e) {
            log.error("Update from user {} failed: {}", u.userId(), e.getMessage(), e);
            sender.sendText(u.chatId(), ErrorMessages.GENERIC);
        }
    }

    private void registerActivity(IncomingUpdate u) {
        if (Labels.isStart(u.trimmedText()) || userService.findUser(u.userId()).isEmpty()) {
            userService.saveUser(u);
        } else {
            userService.touchActivity(u.userId());
        }
    }

    private void onMessage(IncomingUpdate u, boolean manager) {
        String text = u.trimmedText();

        if (Labels.isStart(text)) {
            mainMenu.reset(u.userId(), u.chatId(), "👋 Добро пожаловать! Выберите действие:");
            return;
        }
        if (Labels.isCancel(text)) {
            mainMenu.reset(u.userId(), u.chatId(), "Действие отменено.");
            return;
        }
        if (Labels.MAIN_MENU.equals(text)) {
            mainMenu.reset(u.userId(), u.chatId(), null);
            return;
        }

        ConversationState state = stateService.get(u.userId());
        if (Labels.isBack(text)) {
            goBack(u, state);
            return;
        }
        if (text.startsWith("/") && onCommand(u, manager, text)) {
            return;
        }
        if (onMenuButton(u, manager, text)) {
            return;
        }
        onStepInput(u, manager, state);
    }

    private boolean onCommand(IncomingUpdate u, boolean manager, String text) {
        boolean managerCommand = ManagerItemHandler.isItemCommand(text)
                || text.startsWith("/stats") || text.startsWith("/get_all") || text.startsWith("/sync_users")
                || text.startsWith("/start_booking") || text.startsWith("/manager_booking_");
        if (!managerCommand) {
            return false;
        }
        if (!manager) {
            sender.sendText(u.chatId(), MANAGERS_ONLY);
            return true;
        }
        if (ManagerItemHandler.isItemCommand(text)) {
            managerItems.handle(u);
        } else if (text.startsWith("/stats")) {
            managerStats.showStats(u);
        } else if (text.startsWith("/get_all")) {
            managerBookings.showList(u, 0, null);
        } else if (text.startsWith("/start_booking")) {
            managerBooking.start(u);
        } else if (text.startsWith("/sync_users")) {
            bookingService.requestUsersSync();
            sender.sendText(u.chatId(), "🔄 Синхронизация пользователей запущена.");
        } else {
            Matcher m = MANAGER_BOOKING.matcher(text);
            if (m.matches()) {
                managerBookings.showBooking(u, Long.parseLong(m.group(1)));
            } else {
                sender.sendText(u.chatId(), "Использование: /manager_booking_<номер>");
            }
        }
        return true;
    }

    private boolean onMenuButton(IncomingUpdate u, boolean manager, String text) {
        switch (text) {
            case Labels.CREATE_BOOKING -> userBooking.start(u);
            case Labels.VIEW_SCHEDULE -> schedule.start(u);
            case Labels.ITEMS -> userBooking.showItems(u);
            case Labels.MY_BOOKINGS -> userBooking.showMyBookings(u);
            case Labels.CONTACTS -> mainMenu.showContacts(u.chatId());
            case Labels.ALL_BOOKINGS, Labels.MANAGER_CREATE, Labels.SYNC_BOOKINGS, Labels.SYNC_SCHEDULE -> {
                if (!manager) {
                    sender.sendText(u.chatId(), MANAGERS_ONLY);
                } else {
                    onManagerButton(u, text);
                }
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    private void onManagerButton(IncomingUpdate u, String text) {
        switch (text) {
            case Labels.ALL_BOOKINGS -> managerBookings.showList(u, 0, null);
            case Labels.MANAGER_CREATE -> managerBooking.start(u);
            case Labels.SYNC_BOOKINGS -> {
                bookingService.requestBookingsResync();
                sender.sendText(u.chatId(), "🔄 Синхронизация бронирований запущена.");
            }
            case Labels.SYNC_SCHEDULE -> {
                bookingService.requestScheduleSync();
                sender.sendText(u.chatId(), "📅 Синхронизация расписания запущена.");
            }
            default -> log.warn("Unhandled manager button '{}'", text);
        }
    }

    private void onStepInput(IncomingUpdate u, boolean manager, ConversationState state) {
        if (!state.isConsistent() || (state.step().isManagerFlow() && !manager)) {
            log.info("Stale state {} for user {}, resetting", state.step().code(), u.userId());
            mainMenu.reset(u.userId(), u.chatId(), STALE_SESSION);
            return;
        }
        switch (state.step()) {
            case MAIN_MENU -> mainMenu.show(u.userId(), u.chatId(), null);
            case SELECT_ITEM -> userBooking.prompt(u, state);
            case WAITING_DATE -> userBooking.onDate(u, state);
            case ENTER_NAME -> userBooking.onName(u, state);
            case PHONE_NUMBER, CONFIRMATION -> userBooking.onPhone(u, state);

            case MANAGER_WAITING_CLIENT_NAME -> managerBooking.onClientName(u, state);
            case MANAGER_WAITING_CLIENT_PHONE -> managerBooking.onClientPhone(u, state);
            case MANAGER_WAITING_ITEM_SELECTION, MANAGER_WAITING_DATE_TYPE -> managerBooking.prompt(u, state);
            case MANAGER_WAITING_SINGLE_DATE -> managerBooking.onSingleDate(u, state);
            case MANAGER_WAITING_START_DATE -> managerBooking.onStartDate(u, state);
            case MANAGER_WAITING_END_DATE -> managerBooking.onEndDate(u, state);
            case MANAGER_WAITING_COMMENT -> managerBooking.onComment(u, state);
            case MANAGER_CONFIRM_BOOKING -> managerBooking.onConfirm(u, state);

            case SCHEDULE_SELECT_ITEM -> schedule.prompt(u, state);
            case VIEW_SCHEDULE -> schedule.onMenuChoice(u, state);
            case WAITING_SPECIFIC_DATE -> schedule.onSpecificDate(u, state);
        }
    }

    private void goBack(IncomingUpdate u, ConversationState state) {
        ConversationState previous = stateService.back(state);
        ConversationStep step = previous.step();
        if (step == ConversationStep.MAIN_MENU) {
            mainMenu.show(u.userId(), u.chatId(), null);
        } else if (step.isManagerFlow()) {
            managerBooking.prompt(u, previous);
        } else if (step == ConversationStep.SCHEDULE_SELECT_ITEM || step == ConversationStep.VIEW_SCHEDULE
                || step == ConversationStep.WAITING_SPECIFIC_DATE) {
            schedule.prompt(u, previous);
        } else {
            userBooking.prompt(u, previous);
        }
    }

    private void onCallback(IncomingUpdate u, boolean manager) {
        Optional<Callback> parsed = CallbackData.parse(u.callbackData());
        if (parsed.isEmpty()) {
            log.warn("Unknown callback '{}' from user {}", u.callbackData(), u.userId());
            sender.answerCallback(u.callbackId(), "Неизвестная команда");
            return;
        }
        Callback cb = parsed.get();
        if (requiresManager(cb) && !manager) {
            sender.answerCallback(u.callbackId(), MANAGERS_ONLY);
            return;
        }
        if (!answersItself(cb)) {
            sender.answerCallback(u.callbackId(), null);
        }
        switch (cb.action()) {
            case BACK_TO_MAIN, BACK_TO_MAIN_FROM_SCHEDULE -> mainMenu.reset(u.userId(), u.chatId(), null);
            case ITEMS_PAGE -> userBooking.showPage(u, cb.page());
            case SELECT_ITEM, BOOK_ITEM -> userBooking.onItemSelected(u, cb.id());
            case SCHEDULE_ITEMS_PAGE -> schedule.showPage(u, cb.page(), u.messageId());
            case SCHEDULE_SELECT_ITEM -> schedule.onItemSelected(u, cb.id());
            case MANAGER_ITEMS_PAGE -> managerBooking.showItems(u, cb.page(), u.messageId());
            case MANAGER_SELECT_ITEM -> managerBooking.onItemSelected(u, stateService.get(u.userId()), cb.id());
            case MANAGER_SINGLE_DATE -> managerBooking.onDateType(u, stateService.get(u.userId()), false);
            case MANAGER_DATE_RANGE -> managerBooking.onDateType(u, stateService.get(u.userId()), true);
            case MANAGER_BOOKINGS_PAGE -> managerBookings.showList(u, cb.page(), u.messageId());
            case CONFIRM, REJECT, RESCHEDULE, REOPEN, COMPLETE -> managerBookings.onAction(u, cb.action(), cb.id());
            case CHANGE_ITEM -> managerBookings.showChangeItem(u, cb.id());
            case CHANGE_TO -> managerBookings.onChangeTo(u, cb.id(), cb.secondId());
            case CALL_BOOKING -> managerBookings.onCall(u, cb.id());
            case SHOW_BOOKING -> managerBookings.showBooking(u, cb.id());
            case EXPORT_USERS -> managerStats.exportUsers(u);
        }
    }

    private static boolean requiresManager(Callback cb) {
        return switch (cb.action()) {
            case BACK_TO_MAIN, BACK_TO_MAIN_FROM_SCHEDULE, ITEMS_PAGE, SELECT_ITEM, SCHEDULE_ITEMS_PAGE,
                    SCHEDULE_SELECT_ITEM, BOOK_ITEM -> false;
            default -> true;
        };
    }

    private static boolean answersItself(Callback cb) {
        return switch (cb.action()) {
            case CONFIRM, REJECT, RESCHEDULE, REOPEN, COMPLETE, CHANGE_TO -> true;
            default -> false;
        };
    }
}
