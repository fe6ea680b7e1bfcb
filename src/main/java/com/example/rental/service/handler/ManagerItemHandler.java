package com.example.rental.service.handler;

import com.example.rental.dto.IncomingUpdate;
import com.example.rental.model.Item;
import com.example.rental.service.ChatSender;
import com.example.rental.service.ItemService;
import com.example.rental.service.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Text commands for the item catalogue. Item names may contain spaces, so the numeric
 * argument is always the last token.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManagerItemHandler {

    static final String ADD = "/add_item";
    static final String EDIT = "/edit_item";
    static final String LIST = "/list_items";
    static final String DISABLE = "/disable_item";
    static final String SET_ORDER = "/set_item_order";
    static final String MOVE_UP = "/move_item_up";
    static final String MOVE_DOWN = "/move_item_down";

    private static final List<String> COMMANDS = List.of(ADD, EDIT, LIST, DISABLE, SET_ORDER, MOVE_UP, MOVE_DOWN);

    private final ChatSender sender;
    private final ItemService itemService;

    public static boolean isItemCommand(String text) {
        return COMMANDS.contains(command(text));
    }

    public void handle(IncomingUpdate u) {
        String text = u.trimmedText();
        String[] parts = text.split("\\s+", 2);
        String args = parts.length > 1 ? parts[1].trim() : "";
        switch (command(text)) {
            case ADD -> withNameAndNumber(u, args, "Использование: /add_item <название> <количество>", (name, qty) -> {
                Item item = itemService.create(name, qty);
                sender.sendText(u.chatId(), "✅ Аппарат «%s» добавлен (%d шт.)".formatted(item.getName(), item.getTotalQuantity()));
            });
            case EDIT -> withNameAndNumber(u, args, "Использование: /edit_item <название> <количество>", (name, qty) -> {
                Item item = itemService.updateQuantity(name, qty);
                sender.sendText(u.chatId(), "✅ Количество «%s»: %d шт.".formatted(item.getName(), item.getTotalQuantity()));
            });
            case SET_ORDER -> withNameAndNumber(u, args, "Использование: /set_item_order <название> <позиция>", (name, order) -> {
                Item item = itemService.setOrder(name, order);
                sender.sendText(u.chatId(), "✅ «%s» теперь на позиции %d".formatted(item.getName(), item.getSortOrder()));
            });
            case DISABLE -> withName(u, args, "Использование: /disable_item <название>", name -> {
                Item item = itemService.deactivate(name);
                sender.sendText(u.chatId(), "✅ Аппарат «%s» скрыт из каталога".formatted(item.getName()));
            });
            case MOVE_UP -> withName(u, args, "Использование: /move_item_up <название>", name -> moved(u, itemService.move(name, -1)));
            case MOVE_DOWN -> withName(u, args, "Использование: /move_item_down <название>", name -> moved(u, itemService.move(name, 1)));
            case LIST -> list(u);
            default -> sender.sendText(u.chatId(), "Неизвестная команда.");
        }
    }

    private void list(IncomingUpdate u) {
        List<Item> items = itemService.listActive();
        if (items.isEmpty()) {
            sender.sendText(u.chatId(), "Каталог пуст. Добавьте аппарат: /add_item <название> <количество>");
            return;
        }
        StringBuilder sb = new StringBuilder("💼 Аппараты:\n\n");
        for (Item item : items) {
            sb.append("%d. %s (%d шт.) [id %d]\n".formatted(item.getSortOrder(), item.getName(),
                    item.getTotalQuantity(), item.getId()));
        }
        sender.sendText(u.chatId(), sb.toString().trim());
    }

    private void moved(IncomingUpdate u, Item item) {
        sender.sendText(u.chatId(), "✅ «%s» теперь на позиции %d".formatted(item.getName(), item.getSortOrder()));
    }

    private void withName(IncomingUpdate u, String args, String usage, Consumer<String> action) {
        if (args.isEmpty()) {
            sender.sendText(u.chatId(), usage);
            return;
        }
        action.accept(args);
    }

    private void withNameAndNumber(IncomingUpdate u, String args, String usage, NameAndNumber action) {
        int split = args.lastIndexOf(' ');
        if (split <= 0) {
            sender.sendText(u.chatId(), usage);
            return;
        }
        int number;
        try {
            number = Integer.parseInt(args.substring(split + 1));
        } catch (NumberFormatException e) {
            throw new ValidationException("Последним аргументом должно быть число. " + usage);
        }
        action.accept(args.substring(0, split).trim(), number);
    }

    private static String command(String text) {
        String first = text.split("\\s+", 2)[0];
        int at = first.indexOf('@');
        return (at > 0 ? first.substring(0, at) : first).toLowerCase();
    }

    @FunctionalInterface
    private interface NameAndNumber {
        void accept(String name, int number);
    }
}
