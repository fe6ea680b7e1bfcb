package com.example.rental.model;

import java.util.List;

import static com.example.rental.model.ScratchKeys.*;

/**
 * Steps of the chat dialogue. Each step lists the scratch keys that must be present
 * for input at this step to be meaningful.
 */
public enum ConversationStep {
    MAIN_MENU("main_menu"),
    SELECT_ITEM("select_item"),
    WAITING_DATE("waiting_date", ITEM_ID),
    ENTER_NAME("enter_name", ITEM_ID, DATE),
    PHONE_NUMBER("phone_number", ITEM_ID, DATE, USER_NAME),
    CONFIRMATION("confirmation", ITEM_ID, DATE, USER_NAME, PHONE),

    MANAGER_WAITING_CLIENT_NAME("manager_waiting_client_name", IS_MANAGER_BOOKING),
    MANAGER_WAITING_CLIENT_PHONE("manager_waiting_client_phone", IS_MANAGER_BOOKING, CLIENT_NAME),
    MANAGER_WAITING_ITEM_SELECTION("manager_waiting_item_selection", IS_MANAGER_BOOKING, CLIENT_NAME, CLIENT_PHONE),
    MANAGER_WAITING_DATE_TYPE("manager_waiting_date_type", IS_MANAGER_BOOKING, CLIENT_NAME, CLIENT_PHONE, ITEM_ID),
    MANAGER_WAITING_SINGLE_DATE("manager_waiting_single_date", IS_MANAGER_BOOKING, CLIENT_NAME, CLIENT_PHONE, ITEM_ID, DATE_TYPE),
    MANAGER_WAITING_START_DATE("manager_waiting_start_date", IS_MANAGER_BOOKING, CLIENT_NAME, CLIENT_PHONE, ITEM_ID, DATE_TYPE),
    MANAGER_WAITING_END_DATE("manager_waiting_end_date", IS_MANAGER_BOOKING, CLIENT_NAME, CLIENT_PHONE, ITEM_ID, DATE_TYPE, START_DATE),
    MANAGER_WAITING_COMMENT("manager_waiting_comment", IS_MANAGER_BOOKING, CLIENT_NAME, CLIENT_PHONE, ITEM_ID, DATES),
    MANAGER_CONFIRM_BOOKING("manager_confirm_booking", IS_MANAGER_BOOKING, CLIENT_NAME, CLIENT_PHONE, ITEM_ID, DATES),

    SCHEDULE_SELECT_ITEM("schedule_select_item"),
    VIEW_SCHEDULE("view_schedule", ITEM_ID),
    WAITING_SPECIFIC_DATE("waiting_specific_date", ITEM_ID);

    private final String code;
    private final List<String> requiredKeys;

    ConversationStep(String code, String... requiredKeys) {
        this.code = code;
        this.requiredKeys = List.of(requiredKeys);
    }

    public String code() {
        return code;
    }

    public List<String> requiredKeys() {
        return requiredKeys;
    }

    public boolean isManagerFlow() {
        return name().startsWith("MANAGER_");
    }

    /**
     * Step that "back" returns to. The date-entry branch of the manager chain depends on
     * the chosen date type.
     */
    public ConversationStep previous(String dateType) {
        return switch (this) {
            case MAIN_MENU, SELECT_ITEM, SCHEDULE_SELECT_ITEM, MANAGER_WAITING_CLIENT_NAME -> MAIN_MENU;
            case WAITING_DATE -> SELECT_ITEM;
            case ENTER_NAME -> WAITING_DATE;
            case PHONE_NUMBER -> ENTER_NAME;
            case CONFIRMATION -> PHONE_NUMBER;
            case MANAGER_WAITING_CLIENT_PHONE -> MANAGER_WAITING_CLIENT_NAME;
            case MANAGER_WAITING_ITEM_SELECTION -> MANAGER_WAITING_CLIENT_PHONE;
            case MANAGER_WAITING_DATE_TYPE -> MANAGER_WAITING_ITEM_SELECTION;
            case MANAGER_WAITING_SINGLE_DATE, MANAGER_WAITING_START_DATE -> MANAGER_WAITING_DATE_TYPE;
            case MANAGER_WAITING_END_DATE -> MANAGER_WAITING_START_DATE;
            case MANAGER_WAITING_COMMENT -> DATE_TYPE_RANGE.equals(dateType)
                    ? MANAGER_WAITING_END_DATE
                    : MANAGER_WAITING_SINGLE_DATE;
            case MANAGER_CONFIRM_BOOKING -> MANAGER_WAITING_COMMENT;
            case VIEW_SCHEDULE -> SCHEDULE_SELECT_ITEM;
            case WAITING_SPECIFIC_DATE -> VIEW_SCHEDULE;
        };
    }

    public static ConversationStep fromCode(String code) {
        if (code == null) return MAIN_MENU;
        for (ConversationStep step : values()) {
            if (step.code.equals(code)) return step;
        }
        return MAIN_MENU;
    }
}
