package com.example.rental.service.util;

/**
 * Russian phone numbers: stored as 11 digits starting with 7.
 */
public final class PhoneNumbers {
    private PhoneNumbers() {}

    /** Digits only, {@code 8XXXXXXXXXX} and {@code XXXXXXXXXX} become {@code 7XXXXXXXXXX}; "" when invalid. */
    public static String normalize(String raw) {
        if (raw == null) return "";
        String digits = raw.replaceAll("\\D", "");
        if (digits.length() == 11 && digits.startsWith("8")) {
            return "7" + digits.substring(1);
        }
        if (digits.length() == 11 && digits.startsWith("7")) {
            return digits;
        }
        if (digits.length() == 10) {
            return "7" + digits;
        }
        return "";
    }

    /** {@code +7 (999) 123-45-67}; anything else is returned unchanged. */
    public static String format(String phone) {
        if (phone == null || phone.length() != 11 || !phone.startsWith("7") || !phone.chars().allMatch(Character::isDigit)) {
            return phone == null ? "" : phone;
        }
        return "+7 (%s) %s-%s-%s".formatted(
                phone.substring(1, 4), phone.substring(4, 7), phone.substring(7, 9), phone.substring(9, 11));
    }
}
