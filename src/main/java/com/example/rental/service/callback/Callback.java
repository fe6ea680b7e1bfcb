package com.example.rental.service.callback;

/**
 * Parsed inline button payload.
 *
 * @param id       booking id, item id or page number depending on the action
 * @param secondId item id of {@link CallbackAction#CHANGE_TO}, otherwise 0
 */
public record Callback(CallbackAction action, long id, long secondId) {

    public static Callback of(CallbackAction action) {
        return new Callback(action, 0, 0);
    }

    public static Callback of(CallbackAction action, long id) {
        return new Callback(action, id, 0);
    }

    public int page() {
        return (int) id;
    }
}
