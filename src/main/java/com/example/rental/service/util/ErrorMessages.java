package com.example.rental.service.util;

import com.example.rental.service.exception.ConcurrentBookingModificationException;
import com.example.rental.service.exception.DateTooFarException;
import com.example.rental.service.exception.NotAvailableException;
import com.example.rental.service.exception.NotFoundException;
import com.example.rental.service.exception.PastDateException;
import com.example.rental.service.exception.ValidationException;

/** User-facing text for failures. */
public final class ErrorMessages {
    private ErrorMessages() {}

    public static final String NOT_AVAILABLE =
            "⚠️ Извините, этот аппарат уже забронирован на выбранную дату. Пожалуйста, выберите другую дату или аппарат.";
    public static final String PAST_DATE = "⚠️ Нельзя создавать бронирование на прошедшую дату.";
    public static final String DATE_TOO_FAR = "⚠️ Вы не можете бронировать так далеко в будущем. Максимальный срок: %d дней.";
    public static final String CONFLICT = "⚠️ Заявка уже изменена. Обновите данные и попробуйте снова.";
    public static final String NOT_FOUND = "⚠️ Запись не найдена.";
    public static final String GENERIC = "❌ Произошла ошибка. Попробуйте позже.";

    public static String forException(Throwable e) {
        if (e instanceof NotAvailableException) return NOT_AVAILABLE;
        if (e instanceof PastDateException) return PAST_DATE;
        if (e instanceof DateTooFarException tooFar) return DATE_TOO_FAR.formatted(tooFar.getMaxDays());
        if (e instanceof ConcurrentBookingModificationException) return CONFLICT;
        if (e instanceof NotFoundException) return NOT_FOUND;
        if (e instanceof ValidationException) return "⚠️ " + e.getMessage();
        return GENERIC;
    }

    /** Errors after which the user is sent back to the main menu. */
    public static boolean resetsFlow(Throwable e) {
        return e instanceof NotAvailableException || e instanceof PastDateException;
    }
}
