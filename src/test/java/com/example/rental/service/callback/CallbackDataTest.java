package com.example.rental.service.callback;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackDataTest {

    @Test
    void parsesExactPayloads() {
        assertThat(CallbackData.parse("back_to_main")).contains(Callback.of(CallbackAction.BACK_TO_MAIN));
        assertThat(CallbackData.parse("export_users")).contains(Callback.of(CallbackAction.EXPORT_USERS));
    }

    @Test
    void parsesPrefixedPayloads() {
        assertThat(CallbackData.parse("items_page:2")).contains(Callback.of(CallbackAction.ITEMS_PAGE, 2));
        assertThat(CallbackData.parse("manager_select_item:7"))
                .contains(Callback.of(CallbackAction.MANAGER_SELECT_ITEM, 7));
        assertThat(CallbackData.parse("confirm_42")).contains(Callback.of(CallbackAction.CONFIRM, 42));
        assertThat(CallbackData.parse("change_item_42")).contains(Callback.of(CallbackAction.CHANGE_ITEM, 42));
    }

    @Test
    void changeToCarriesBookingAndItem() {
        assertThat(CallbackData.parse("change_to_42_7"))
                .contains(new Callback(CallbackAction.CHANGE_TO, 42, 7));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "confirm_", "confirm_abc", "change_to_1", "change_to_1_x", "unknown:1", "items_page:-1"})
    void rejectsMalformedPayloads(String data) {
        assertThat(CallbackData.parse(data)).isEmpty();
    }

    @Test
    void builtPayloadsParseBack() {
        assertThat(CallbackData.parse(CallbackData.bookingAction(CallbackAction.RESCHEDULE, 5)))
                .contains(Callback.of(CallbackAction.RESCHEDULE, 5));
        assertThat(CallbackData.parse(CallbackData.changeTo(5, 9)))
                .contains(new Callback(CallbackAction.CHANGE_TO, 5, 9));
        assertThat(CallbackData.changeTo(Long.MAX_VALUE, Long.MAX_VALUE).getBytes()).hasSizeLessThanOrEqualTo(64);
    }
}
