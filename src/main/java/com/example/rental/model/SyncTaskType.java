package com.example.rental.model;

public enum SyncTaskType {
    UPSERT(true),
    UPDATE_STATUS(true),
    SYNC_SCHEDULE(false),
    REPLACE_BOOKINGS(false),
    SYNC_USERS(false);

    private final boolean perBooking;

    SyncTaskType(boolean perBooking) {
        this.perBooking = perBooking;
    }

    /** Whole-sheet kinds are coalesced while a pending row exists. */
    public boolean isPerBooking() {
        return perBooking;
    }
}
