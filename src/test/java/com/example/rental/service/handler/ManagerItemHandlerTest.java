package com.example.rental.service.handler;

import com.example.rental.dto.IncomingUpdate;
import com.example.rental.model.Item;
import com.example.rental.service.ChatSender;
import com.example.rental.service.ItemService;
import com.example.rental.service.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ManagerItemHandlerTest {

    private ChatSender sender;
    private ItemService itemService;
    private ManagerItemHandler handler;

    @BeforeEach
    void setUp() {
        sender = Mockito.mock(ChatSender.class);
        itemService = Mockito.mock(ItemService.class);
        handler = new ManagerItemHandler(sender, itemService);
    }

    private static IncomingUpdate command(String text) {
        return IncomingUpdate.builder().userId(100L).chatId(100L).text(text).build();
    }

    private static Item item(String name, int qty, int order) {
        Item item = new Item();
        item.setId(1L);
        item.setName(name);
        item.setTotalQuantity(qty);
        item.setSortOrder(order);
        return item;
    }

    @Test
    void recognisesCommandsAddressedToTheBot() {
        assertThat(ManagerItemHandler.isItemCommand("/add_item Canon 1")).isTrue();
        assertThat(ManagerItemHandler.isItemCommand("/LIST_ITEMS@rental_bot")).isTrue();
        assertThat(ManagerItemHandler.isItemCommand("/stats")).isFalse();
    }

    @Test
    void addTakesTheLastTokenAsQuantity() {
        when(itemService.create("Canon EOS R6", 2)).thenReturn(item("Canon EOS R6", 2, 3));

        handler.handle(command("/add_item@rental_bot Canon EOS R6 2"));

        verify(itemService).create("Canon EOS R6", 2);
        verify(sender).sendText(eq(100L), contains("«Canon EOS R6» добавлен (2 шт.)"));
    }

    @Test
    void moveDownShiftsByOne() {
        when(itemService.move("DJI Mini", 1)).thenReturn(item("DJI Mini", 1, 4));

        handler.handle(command("/move_item_down DJI Mini"));

        verify(sender).sendText(eq(100L), contains("позиции 4"));
    }

    @Test
    void missingArgumentsShowUsage() {
        handler.handle(command("/edit_item"));
        handler.handle(command("/disable_item"));

        verify(sender).sendText(eq(100L), contains("Использование: /edit_item"));
        verify(sender).sendText(eq(100L), contains("Использование: /disable_item"));
        verify(itemService, never()).updateQuantity(anyString(), anyInt());
    }

    @Test
    void nonNumericQuantityIsRejected() {
        assertThatThrownBy(() -> handler.handle(command("/edit_item Canon R6 many")))
                .isInstanceOf(ValidationException.class);
    }
}
