package com.example.rental.service.util;

import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class PaginationTest {

    private final List<Integer> numbers = IntStream.rangeClosed(1, 17).boxed().toList();

    @Test
    void slicesPages() {
        Pagination<Integer> page = Pagination.of(numbers, 1, 8);
        assertThat(page.items()).containsExactly(9, 10, 11, 12, 13, 14, 15, 16);
        assertThat(page.totalPages()).isEqualTo(3);
        assertThat(page.hasPrevious()).isTrue();
        assertThat(page.hasNext()).isTrue();
        assertThat(page.caption()).isEqualTo("Страница 2 из 3");
    }

    @Test
    void clampsOutOfRangePage() {
        assertThat(Pagination.of(numbers, 99, 8).page()).isEqualTo(2);
        assertThat(Pagination.of(numbers, -3, 8).page()).isZero();
        assertThat(Pagination.of(List.of(), 0, 8).totalPages()).isEqualTo(1);
    }

    @Test
    void keyboardHasNavigationAndBackRows() {
        InlineKeyboardMarkup markup = Pagination.of(numbers, 0, 8)
                .keyboard(n -> KeyboardUtil.btn("#" + n, "n:" + n), "p:", "Назад", "back");
        List<List<InlineKeyboardButton>> rows = markup.getKeyboard();

        assertThat(rows).hasSize(10);
        assertThat(rows.get(8)).extracting(InlineKeyboardButton::getCallbackData).containsExactly("p:1");
        assertThat(rows.get(9).get(0).getCallbackData()).isEqualTo("back");
    }
}
