package com.example.rental.service.util;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;

import java.util.ArrayList;
import java.util.List;

public final class KeyboardUtil {
    private KeyboardUtil() {}

    public static InlineKeyboardButton btn(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton(text);
        b.setCallbackData(data);
        return b;
    }

    public static InlineKeyboardMarkup rows(List<List<InlineKeyboardButton>> rows) {
        InlineKeyboardMarkup mk = new InlineKeyboardMarkup();
        mk.setKeyboard(rows);
        return mk;
    }

    public static InlineKeyboardMarkup single(String text, String data) {
        return rows(List.of(List.of(btn(text, data))));
    }

    /** Reply keyboard, one row per array. */
    public static ReplyKeyboardMarkup reply(List<List<String>> labels) {
        List<KeyboardRow> keyboard = new ArrayList<>();
        for (List<String> line : labels) {
            KeyboardRow row = new KeyboardRow();
            line.forEach(row::add);
            keyboard.add(row);
        }
        ReplyKeyboardMarkup mk = new ReplyKeyboardMarkup(keyboard);
        mk.setResizeKeyboard(true);
        return mk;
    }

    /** Reply keyboard with a contact-request button above the given rows. */
    public static ReplyKeyboardMarkup contactRequest(String label, List<List<String>> extra) {
        KeyboardButton contact = new KeyboardButton(label);
        contact.setRequestContact(true);
        KeyboardRow first = new KeyboardRow();
        first.add(contact);

        List<KeyboardRow> keyboard = new ArrayList<>();
        keyboard.add(first);
        for (List<String> line : extra) {
            KeyboardRow row = new KeyboardRow();
            line.forEach(row::add);
            keyboard.add(row);
        }
        ReplyKeyboardMarkup mk = new ReplyKeyboardMarkup(keyboard);
        mk.setResizeKeyboard(true);
        mk.setOneTimeKeyboard(true);
        return mk;
    }
}
