package com.example.rental.service.handler;

import com.example.rental.service.ChatSender;
import com.example.rental.service.ConversationStateService;
import com.example.rental.service.UserService;
import com.example.rental.service.util.KeyboardUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;

import java.util.ArrayList;
import java.util.List;

import static com.example.rental.service.handler.Labels.*;

@Component
@RequiredArgsConstructor
public class MainMenuHandler {

    static final String WELCOME = "Выберите действие:";

    private final ChatSender sender;
    private final UserService userService;
    private final ConversationStateService stateService;

    /** Clears the conversation and shows the menu. */
    public void reset(long userId, long chatId, String text) {
        stateService.clear(userId);
        show(userId, chatId, text);
    }

    public void show(long userId, long chatId, String text) {
        sender.send(chatId, text == null ? WELCOME : text, keyboard(userService.isManager(userId)));
    }

    public void showContacts(long chatId) {
        List<String> contacts = userService.managerContacts();
        if (contacts.isEmpty()) {
            sender.sendText(chatId, "📞 Контакты менеджеров пока не указаны.");
            return;
        }
        StringBuilder sb = new StringBuilder("📞 Контакты менеджеров:\n\n");
        contacts.forEach(c -> sb.append("• ").append(c).append('\n'));
        sender.sendText(chatId, sb.toString().trim());
    }

    static ReplyKeyboardMarkup keyboard(boolean manager) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of(CREATE_BOOKING));
        rows.add(List.of(VIEW_SCHEDULE, ITEMS));
        rows.add(List.of(MY_BOOKINGS, CONTACTS));
        if (manager) {
            rows.add(List.of(ALL_BOOKINGS, MANAGER_CREATE));
            rows.add(List.of(SYNC_BOOKINGS, SYNC_SCHEDULE));
        }
        return KeyboardUtil.reply(rows);
    }
}
