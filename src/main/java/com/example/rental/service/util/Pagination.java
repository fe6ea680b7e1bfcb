package com.example.rental.service.util;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static com.example.rental.service.util.KeyboardUtil.btn;

/**
 * One page of a list rendered as inline buttons with prev/next and back navigation.
 * Pages are 0-based; a page past the end shows the last one.
 */
public record Pagination<T>(List<T> items, int page, int totalPages, int totalItems) {

    public static <T> Pagination<T> of(List<T> all, int requestedPage, int pageSize) {
        int size = Math.max(pageSize, 1);
        int totalPages = Math.max(1, (all.size() + size - 1) / size);
        int page = Math.min(Math.max(requestedPage, 0), totalPages - 1);
        int from = page * size;
        int to = Math.min(from + size, all.size());
        return new Pagination<>(List.copyOf(all.subList(from, to)), page, totalPages, all.size());
    }

    public boolean hasPrevious() {
        return page > 0;
    }

    public boolean hasNext() {
        return page < totalPages - 1;
    }

    public String caption() {
        return "Страница %d из %d".formatted(page + 1, totalPages);
    }

    /**
     * @param button     one button per item, each on its own row
     * @param pagePrefix callback prefix, the target page number is appended
     * @param backData   callback of the back-to-root button
     */
    public InlineKeyboardMarkup keyboard(Function<T, InlineKeyboardButton> button, String pagePrefix,
                                         String backText, String backData) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (T item : items) {
            rows.add(List.of(button.apply(item)));
        }
        List<InlineKeyboardButton> nav = new ArrayList<>();
        if (hasPrevious()) {
            nav.add(btn("⬅️ Назад", pagePrefix + (page - 1)));
        }
        if (hasNext()) {
            nav.add(btn("Вперед ➡️", pagePrefix + (page + 1)));
        }
        if (!nav.isEmpty()) {
            rows.add(nav);
        }
        rows.add(List.of(btn(backText, backData)));
        return KeyboardUtil.rows(rows);
    }
}
