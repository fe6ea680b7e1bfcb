package com.example.rental.service.callback;

public enum CallbackAction {
    BACK_TO_MAIN,
    BACK_TO_MAIN_FROM_SCHEDULE,
    ITEMS_PAGE,
    SELECT_ITEM,
    SCHEDULE_ITEMS_PAGE,
    SCHEDULE_SELECT_ITEM,
    BOOK_ITEM,
    MANAGER_ITEMS_PAGE,
    MANAGER_SELECT_ITEM,
    MANAGER_SINGLE_DATE,
    MANAGER_DATE_RANGE,
    MANAGER_BOOKINGS_PAGE,
    CONFIRM,
    REJECT,
    RESCHEDULE,
    REOPEN,
    COMPLETE,
    CHANGE_ITEM,
    CHANGE_TO,
    CALL_BOOKING,
    SHOW_BOOKING,
    EXPORT_USERS
}
