package com.example.rental.service.handler;

import java.util.Set;

/** Reply keyboard captions and the text commands they stand for. */
public final class Labels {
    private Labels() {}

    public static final String CREATE_BOOKING = "📋 СОЗДАТЬ ЗАЯВКУ";
    public static final String VIEW_SCHEDULE = "📅 Посмотреть расписание";
    public static final String ITEMS = "💼 Ассортимент";
    public static final String MY_BOOKINGS = "📊 Мои заявки";
    public static final String CONTACTS = "📞 Контакты менеджеров";

    public static final String ALL_BOOKINGS = "👨‍💼 Все заявки";
    public static final String MANAGER_CREATE = "➕ Создать заявку (Менеджер)";
    public static final String SYNC_BOOKINGS = "🔄 Синхронизировать бронирования";
    public static final String SYNC_SCHEDULE = "📅 Синхронизировать расписание";

    public static final String BACK = "⬅️ Назад";
    public static final String CANCEL = "❌ Отмена";
    public static final String MAIN_MENU = "🏠 Главное меню";
    public static final String SEND_CONTACT = "📱 Отправить номер";

    public static final String SCHEDULE_30_DAYS = "📅 30 дней";
    public static final String SCHEDULE_PICK_DATE = "🗓 Выбрать дату";
    public static final String SCHEDULE_BACK_TO_ITEMS = "⬅️ Назад к выбору аппарата";
    public static final String SCHEDULE_BOOK = "📋 Забронировать";

    public static final String MANAGER_CONFIRM = "✅ Подтвердить создание";
    public static final String SKIP = "Пропустить";

    public static final Set<String> START_WORDS = Set.of("/start", "сброс", "reset");
    public static final Set<String> CANCEL_WORDS = Set.of(CANCEL, "отмена", "cancel", "/cancel");
    public static final Set<String> BACK_WORDS = Set.of(BACK, "назад", "back");

    public static boolean isStart(String text) {
        return START_WORDS.contains(text.toLowerCase());
    }

    public static boolean isCancel(String text) {
        return CANCEL_WORDS.contains(text) || CANCEL_WORDS.contains(text.toLowerCase());
    }

    public static boolean isBack(String text) {
        return BACK_WORDS.contains(text) || BACK_WORDS.contains(text.toLowerCase());
    }
}
