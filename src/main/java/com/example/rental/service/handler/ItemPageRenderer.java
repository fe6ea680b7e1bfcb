package com.example.rental.service.handler;

import com.example.rental.config.BotConfig;
import com.example.rental.model.Item;
import com.example.rental.service.ChatSender;
import com.example.rental.service.ItemService;
import com.example.rental.service.util.Pagination;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;

import java.util.List;
import java.util.function.LongFunction;

import static com.example.rental.service.util.KeyboardUtil.btn;

/** Paged list of active items as inline buttons. */
@Component
@RequiredArgsConstructor
public class ItemPageRenderer {

    private final ItemService itemService;
    private final ChatSender sender;
    private final BotConfig config;

    /**
     * Sends the page, or edits {@code messageId} when navigating inside an existing list.
     *
     * @return false when there are no active items
     */
    public boolean render(long chatId, Integer messageId, String title, int page,
                          LongFunction<String> selectData, String pagePrefix, String backData) {
        List<Item> items = itemService.listActive();
        if (items.isEmpty()) {
            sender.sendText(chatId, "😔 Сейчас нет доступных аппаратов.");
            return false;
        }
        Pagination<Item> view = Pagination.of(items, page, pageSize());
        InlineKeyboardMarkup keyboard = view.keyboard(
                item -> btn(item.getName(), selectData.apply(item.getId())),
                pagePrefix, Labels.MAIN_MENU, backData);
        String text = view.totalPages() > 1 ? title + "\n\n" + view.caption() : title;

        if (messageId != null) {
            sender.editMessage(chatId, messageId, text, keyboard);
        } else {
            sender.send(chatId, text, keyboard);
        }
        return true;
    }

    private int pageSize() {
        return config.getPaginationSize() > 0 ? config.getPaginationSize() : 8;
    }
}
