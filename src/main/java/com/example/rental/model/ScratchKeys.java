package com.example.rental.model;

/** Keys of the conversation scratch map. */
public final class ScratchKeys {
    private ScratchKeys() {}

    public static final String ITEM_ID = "item_id";
    public static final String DATE = "date";
    public static final String DATES = "dates";
    public static final String DATE_TYPE = "date_type";
    public static final String START_DATE = "start_date";
    public static final String USER_NAME = "user_name";
    public static final String PHONE = "phone";
    public static final String CLIENT_NAME = "client_name";
    public static final String CLIENT_PHONE = "client_phone";
    public static final String COMMENT = "comment";
    public static final String IS_MANAGER_BOOKING = "is_manager_booking";
    public static final String PAGE = "page";

    public static final String DATE_TYPE_SINGLE = "single";
    public static final String DATE_TYPE_RANGE = "range";

    /** Version of a booking as shown to a manager, {@code version_<bookingId>}. */
    public static String version(long bookingId) {
        return "version_" + bookingId;
    }
}
